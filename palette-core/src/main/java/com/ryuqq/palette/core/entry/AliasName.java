package com.ryuqq.palette.core.entry;

/**
 * 다른 엔트리를 가리키는 alias.
 *
 * <p>대상 존재 여부는 생성 시점이 아니라 팔레트 해석 시점에 검증됩니다.</p>
 *
 * @param target 대상 엔트리 이름 (null 또는 빈 문자열 불가)
 *
 * @author Palette Team
 * @since 1.0.0
 */
public record AliasName(String target) implements ColorEntry {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException target이 null이거나 빈 문자열인 경우
     */
    public AliasName {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("alias target cannot be null or blank");
        }
    }
}
