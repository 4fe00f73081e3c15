package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.exception.StrictLookupException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 없는 키 조회 시 실패하는 이름 → CSS hex 뷰.
 *
 * <p>{@link Palette#asCssHash()}와 같은 내용을 담지만, {@link #get(String)}은
 * 없는 키에 대해 null이나 빈 문자열 대신 {@link StrictLookupException}을 발생시킵니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class StrictCssHash {

    private final Map<String, String> hexByName;

    StrictCssHash(Map<String, String> hexByName) {
        this.hexByName = Collections.unmodifiableMap(new LinkedHashMap<>(hexByName));
    }

    /**
     * CSS hex 조회.
     *
     * @param key 색상 이름
     * @return CSS hex 문자열
     * @throws StrictLookupException key가 없는 경우
     */
    public String get(String key) {
        String hex = hexByName.get(key);
        if (hex == null) {
            throw new StrictLookupException(key);
        }
        return hex;
    }

    public boolean containsKey(String key) {
        return hexByName.containsKey(key);
    }

    public Set<String> names() {
        return hexByName.keySet();
    }

    public int size() {
        return hexByName.size();
    }

    /**
     * 일반 Map으로 변환 (수정 불가).
     *
     * @return 이름 → CSS hex
     */
    public Map<String, String> toMap() {
        return hexByName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hexByName.equals(((StrictCssHash) o).hexByName);
    }

    @Override
    public int hashCode() {
        return hexByName.hashCode();
    }

    @Override
    public String toString() {
        return "StrictCssHash" + hexByName;
    }
}
