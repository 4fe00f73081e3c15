package com.ryuqq.palette.schema;

import com.ryuqq.palette.core.exception.UnknownColorException;
import com.ryuqq.palette.core.palette.Palette;
import com.ryuqq.palette.core.spi.RequiredNamesQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 애플리케이션이 요구하는 색상 이름 집합.
 *
 * <p>팔레트를 스키마에 대해 검증하거나({@link #check(Palette)}), 스키마를 만족하는
 * 최소 팔레트로 줄이는 데({@link #optimize(Palette)}) 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PaletteSchema schema = PaletteSchema.of("sidebarText", "background");
 *
 * schema.check(palette);                 // 없는 이름이 있으면 UnknownColorException
 * Palette embedded = schema.optimize(palette);
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>이름은 null 또는 빈 문자열 불가</li>
 *   <li>중복 이름은 첫 번째만 유지 (순서 보존)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class PaletteSchema implements RequiredNamesQuery {

    private static final Logger log = LoggerFactory.getLogger(PaletteSchema.class);

    private final List<String> requiredNames;

    private PaletteSchema(Collection<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("required names cannot be null");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("required name cannot be null or blank");
            }
            unique.add(name);
        }
        this.requiredNames = Collections.unmodifiableList(new ArrayList<>(unique));
    }

    /**
     * PaletteSchema 생성.
     *
     * @param names 필요한 색상 이름
     * @return PaletteSchema 인스턴스
     * @throws IllegalArgumentException 이름이 null이거나 빈 문자열인 경우
     */
    public static PaletteSchema of(String... names) {
        if (names == null) {
            throw new IllegalArgumentException("required names cannot be null");
        }
        return new PaletteSchema(Arrays.asList(names));
    }

    /**
     * PaletteSchema 생성.
     *
     * @param names 필요한 색상 이름
     * @return PaletteSchema 인스턴스
     * @throws IllegalArgumentException 컬렉션이나 이름이 null이거나 빈 문자열인 경우
     */
    public static PaletteSchema of(Collection<String> names) {
        return new PaletteSchema(names);
    }

    @Override
    public List<String> requiredNames() {
        return requiredNames;
    }

    /**
     * 팔레트가 스키마를 만족하는지 검증.
     *
     * <p>{@link Palette#optimizedFor(RequiredNamesQuery)}를 시도하는 것과 같습니다.</p>
     *
     * @param palette 검증할 팔레트
     * @throws IllegalArgumentException palette가 null인 경우
     * @throws UnknownColorException 필요한 이름이 팔레트에 없는 경우
     */
    public void check(Palette palette) {
        optimize(palette);
        log.debug("Palette satisfies schema of {} colors", requiredNames.size());
    }

    /**
     * 필요한 이름이 모두 있는지 확인.
     *
     * <p>해석 오류(MissingReference, Cycle)는 false로 바꾸지 않고 그대로 전파됩니다.</p>
     *
     * @param palette 확인할 팔레트
     * @return 만족 여부
     * @throws IllegalArgumentException palette가 null인 경우
     */
    public boolean isSatisfiedBy(Palette palette) {
        return missingNames(palette).isEmpty();
    }

    /**
     * 팔레트에 없는 필요 이름 목록.
     *
     * @param palette 확인할 팔레트
     * @return 없는 이름 (스키마 순서, 수정 불가)
     * @throws IllegalArgumentException palette가 null인 경우
     */
    public List<String> missingNames(Palette palette) {
        requirePalette(palette);
        List<String> missing = new ArrayList<>();
        for (String name : requiredNames) {
            if (!palette.has(name)) {
                missing.add(name);
            }
        }
        return Collections.unmodifiableList(missing);
    }

    /**
     * 스키마를 만족하는 최소 팔레트 생성.
     *
     * @param palette 원본 팔레트
     * @return 필요한 색상만 담은 새 팔레트
     * @throws IllegalArgumentException palette가 null인 경우
     * @throws UnknownColorException 필요한 이름이 팔레트에 없는 경우
     */
    public Palette optimize(Palette palette) {
        requirePalette(palette);
        return palette.optimizedFor(this);
    }

    private static void requirePalette(Palette palette) {
        if (palette == null) {
            throw new IllegalArgumentException("palette cannot be null");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return requiredNames.equals(((PaletteSchema) o).requiredNames);
    }

    @Override
    public int hashCode() {
        return requiredNames.hashCode();
    }

    @Override
    public String toString() {
        return "PaletteSchema" + requiredNames;
    }
}
