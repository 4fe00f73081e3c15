package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.color.Color;
import com.ryuqq.palette.core.entry.AliasName;
import com.ryuqq.palette.core.entry.ColorEntry;
import com.ryuqq.palette.core.entry.Concrete;
import com.ryuqq.palette.core.exception.CycleException;
import com.ryuqq.palette.core.exception.MissingReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 원본 엔트리를 구체 색상 맵으로 해석.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. Pass 1: 모든 Concrete 엔트리의 색상을 결과에 복사
 * 2. Pass 2: 각 AliasName 엔트리마다 체인을 따라감
 *    a. 현재 이름이 원본에 없음       → MissingReferenceException(key, current)
 *    b. 현재 이름이 이미 해석됨       → 그 색상을 채택하고 종료
 *    c. 그 외                         → alias 대상으로 이동
 *       (이번 탐색에서 이미 본 이름이면 CycleException(target))
 * 3. 완료된 탐색이 지나간 이름들도 같은 색상으로 기록 (이후 탐색의 기준점)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>결과는 전부 아니면 전무: 하나라도 실패하면 예외만 전파되고 부분 결과는 반환되지 않음</li>
 *   <li>결과 키 집합 = 원본 키 집합, 순서는 원본 순서</li>
 *   <li>alias는 대상 엔트리와 동일한 Color 인스턴스를 공유</li>
 *   <li>탐색 순서와 무관하게 같은 입력은 같은 결과 (seen 집합은 키마다 새로 생성)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
final class PaletteResolver {

    // Utility class - prevent instantiation
    private PaletteResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원본 엔트리 해석.
     *
     * @param rawEntries 원본 엔트리
     * @return 이름 → 색상 (수정 불가)
     * @throws MissingReferenceException alias가 없는 이름을 가리키는 경우
     * @throws CycleException alias 체인이 순환하는 경우
     */
    static Map<String, Color> resolve(Map<String, ColorEntry> rawEntries) {
        Map<String, Color> resolved = new HashMap<>(rawEntries.size() * 2);

        for (Map.Entry<String, ColorEntry> entry : rawEntries.entrySet()) {
            if (entry.getValue() instanceof Concrete concrete) {
                resolved.put(entry.getKey(), concrete.color());
            }
        }

        for (Map.Entry<String, ColorEntry> entry : rawEntries.entrySet()) {
            String key = entry.getKey();
            if (resolved.containsKey(key)) {
                continue;
            }
            // key 자신을 포함한 경로 전체가 기록됨
            followChain(key, rawEntries, resolved);
        }

        Map<String, Color> ordered = new LinkedHashMap<>(rawEntries.size() * 2);
        for (String key : rawEntries.keySet()) {
            ordered.put(key, resolved.get(key));
        }
        return Collections.unmodifiableMap(ordered);
    }

    private static Color followChain(String key,
                                     Map<String, ColorEntry> rawEntries,
                                     Map<String, Color> resolved) {
        Set<String> seen = new HashSet<>();
        List<String> path = new ArrayList<>();
        String current = key;

        while (true) {
            ColorEntry entry = rawEntries.get(current);
            if (entry == null) {
                throw new MissingReferenceException(key, current);
            }

            Color color = resolved.get(current);
            if (color != null) {
                for (String name : path) {
                    resolved.put(name, color);
                }
                return color;
            }

            // 해석되지 않은 이름은 Pass 1 이후 항상 alias
            path.add(current);
            current = ((AliasName) entry).target();
            if (!seen.add(current)) {
                throw new CycleException(current);
            }
        }
    }
}
