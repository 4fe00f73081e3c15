package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.color.Color;
import com.ryuqq.palette.core.color.ColorParser;
import com.ryuqq.palette.core.entry.ColorEntry;
import com.ryuqq.palette.core.entry.Concrete;
import com.ryuqq.palette.core.exception.CycleException;
import com.ryuqq.palette.core.exception.MissingReferenceException;
import com.ryuqq.palette.core.exception.UnknownColorException;
import com.ryuqq.palette.core.spi.RequiredNamesQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 이름이 붙은 색상 집합.
 *
 * <p>각 엔트리의 값은 구체 색상이거나 같은 팔레트의 다른 엔트리 이름(alias)입니다.
 * 예를 들어 다음과 같은 팔레트가 가능합니다:</p>
 * <pre>
 * highlights        → #f0f000
 * background        → #333
 * sidebarBackground → #88d
 * sidebarText       → highlights
 * sidebarBorder     → sidebarText
 * </pre>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * 1. create(rawEntries)   → 생성 (alias 대상은 아직 검증하지 않음)
 * 2. 첫 조회 (get, names, asCssHash, ...) → 해석 1회 실행 후 캐시
 * 3. 이후 조회            → 캐시된 결과 사용
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 원본 엔트리는 변경 불가. 해석 결과의 지연 계산이
 * 유일한 내부 상태 변화이며, 동시 첫 접근은 하나의 해석으로 직렬화됩니다.</p>
 *
 * <p><strong>실패 처리:</strong> 해석이 실패하면 아무것도 캐시하지 않습니다.
 * 이후 조회는 해석을 다시 시도하며 입력이 불변이므로 같은 예외가 재현됩니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class Palette {

    private static final Logger log = LoggerFactory.getLogger(Palette.class);

    private final Map<String, ColorEntry> rawEntries;
    private final Object resolveLock = new Object();
    private volatile Map<String, Color> resolvedEntries;

    private Palette(Map<String, ColorEntry> rawEntries) {
        this.rawEntries = rawEntries;
    }

    /**
     * Palette 생성.
     *
     * <p>맵 구조만 검증하며 alias 대상 존재 여부는 첫 조회 시점에 검증됩니다.</p>
     *
     * @param rawEntries 이름 → ColorEntry
     * @return Palette 인스턴스
     * @throws IllegalArgumentException 맵이 null이거나, 키가 null/빈 문자열이거나, 값이 null인 경우
     */
    public static Palette create(Map<String, ? extends ColorEntry> rawEntries) {
        if (rawEntries == null) {
            throw new IllegalArgumentException("rawEntries cannot be null");
        }
        Map<String, ColorEntry> copy = new LinkedHashMap<>(rawEntries.size() * 2);
        for (Map.Entry<String, ? extends ColorEntry> entry : rawEntries.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("color name cannot be null or blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("entry for " + name + " cannot be null");
            }
            copy.put(name, entry.getValue());
        }
        return new Palette(Collections.unmodifiableMap(copy));
    }

    /**
     * 원시 리터럴로 Palette 생성 (기본 파서).
     *
     * @param literals 이름 → 리터럴 (hex 문자열, RGB 배열, Color, alias 이름)
     * @return Palette 인스턴스
     * @throws IllegalArgumentException 변환할 수 없는 리터럴이 있는 경우
     * @see ColorParser
     */
    public static Palette fromLiterals(Map<String, ?> literals) {
        return fromLiterals(literals, ColorParser.defaults());
    }

    /**
     * 원시 리터럴로 Palette 생성.
     *
     * @param literals 이름 → 리터럴
     * @param parser 리터럴 변환기
     * @return Palette 인스턴스
     * @throws IllegalArgumentException literals나 parser가 null이거나 변환할 수 없는 리터럴이 있는 경우
     */
    public static Palette fromLiterals(Map<String, ?> literals, ColorParser parser) {
        if (literals == null) {
            throw new IllegalArgumentException("literals cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        Map<String, ColorEntry> entries = new LinkedHashMap<>(literals.size() * 2);
        for (Map.Entry<String, ?> literal : literals.entrySet()) {
            entries.put(literal.getKey(), parser.parse(literal.getValue()));
        }
        return create(entries);
    }

    /**
     * 이름이 팔레트에 있는지 확인.
     *
     * @param name 색상 이름
     * @return 존재 여부
     * @throws MissingReferenceException 해석 실패 시
     * @throws CycleException 해석 실패 시
     */
    public boolean has(String name) {
        return resolved().containsKey(name);
    }

    /**
     * 해석된 색상 조회.
     *
     * @param name 색상 이름
     * @return 구체 색상
     * @throws UnknownColorException name이 팔레트에 없는 경우
     * @throws MissingReferenceException 해석 실패 시
     * @throws CycleException 해석 실패 시
     */
    public Color get(String name) {
        Color color = resolved().get(name);
        if (color == null) {
            throw new UnknownColorException(name);
        }
        return color;
    }

    /**
     * 모든 색상 이름 (수정 불가).
     *
     * @return 이름 집합
     */
    public Set<String> names() {
        return resolved().keySet();
    }

    /**
     * 해석된 색상 수.
     *
     * @return 색상 수
     */
    public int size() {
        return resolved().size();
    }

    /**
     * 생성 시 전달된 원본 엔트리 (수정 불가).
     *
     * @return 이름 → ColorEntry
     */
    public Map<String, ColorEntry> rawEntries() {
        return rawEntries;
    }

    /**
     * 이름 → CSS hex 맵.
     *
     * <p>예: {@code {highlights=#f0f000, sidebarText=#f0f000, ...}}</p>
     *
     * @return 수정 불가 맵
     */
    public Map<String, String> asCssHash() {
        Map<String, Color> resolved = resolved();
        Map<String, String> hexByName = new LinkedHashMap<>(resolved.size() * 2);
        for (Map.Entry<String, Color> entry : resolved.entrySet()) {
            hexByName.put(entry.getKey(), entry.getValue().toCssHex());
        }
        return Collections.unmodifiableMap(hexByName);
    }

    /**
     * {@link #asCssHash()}와 같은 내용이지만 없는 키 조회 시 실패하는 뷰.
     *
     * @return StrictCssHash
     */
    public StrictCssHash asStrictCssHash() {
        return new StrictCssHash(asCssHash());
    }

    /**
     * 필요한 색상만 담은 새 Palette 생성.
     *
     * <p>결과 팔레트의 엔트리는 모두 {@link Concrete}이므로 결과 팔레트는
     * 자체 해석 중 {@link MissingReferenceException}이나 {@link CycleException}을
     * 발생시킬 수 없습니다. 원본 팔레트는 변경되지 않습니다.</p>
     *
     * <p>"팔레트가 스키마를 만족하는가"는 이 메서드가 예외 없이 끝나는가와 같습니다.</p>
     *
     * @param query 필요한 이름 목록 제공자
     * @return 새 Palette
     * @throws IllegalArgumentException query가 null이거나 null 목록을 반환한 경우
     * @throws UnknownColorException 필요한 이름이 팔레트에 없는 경우
     */
    public Palette optimizedFor(RequiredNamesQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        List<String> requiredNames = query.requiredNames();
        if (requiredNames == null) {
            throw new IllegalArgumentException("requiredNames cannot be null");
        }

        Map<String, ColorEntry> subset = new LinkedHashMap<>(requiredNames.size() * 2);
        for (String name : requiredNames) {
            subset.put(name, new Concrete(get(name)));
        }

        log.debug("Optimized palette: {} of {} colors kept", subset.size(), rawEntries.size());
        return create(subset);
    }

    /**
     * {@link #optimizedFor(RequiredNamesQuery)}의 이전 이름.
     *
     * @param query 필요한 이름 목록 제공자
     * @return 새 Palette
     * @deprecated {@link #optimizedFor(RequiredNamesQuery)}를 사용하세요.
     */
    @Deprecated
    public Palette optimizeFor(RequiredNamesQuery query) {
        log.warn("Palette.optimizeFor is deprecated, use optimizedFor instead");
        return optimizedFor(query);
    }

    private Map<String, Color> resolved() {
        Map<String, Color> result = resolvedEntries;
        if (result != null) {
            return result;
        }
        synchronized (resolveLock) {
            if (resolvedEntries == null) {
                Map<String, Color> computed = PaletteResolver.resolve(rawEntries);
                log.debug("Resolved palette: {} colors ({} aliases)", computed.size(), countAliases());
                resolvedEntries = computed;
            }
            return resolvedEntries;
        }
    }

    private long countAliases() {
        return rawEntries.values().stream().filter(ColorEntry::isAlias).count();
    }

    @Override
    public String toString() {
        return "Palette{" + rawEntries.size() + " colors, " + (resolvedEntries == null ? "unresolved" : "resolved") + '}';
    }
}
