package com.ryuqq.palette.core.entry;

import com.ryuqq.palette.core.color.Color;

/**
 * 구체 색상 엔트리.
 *
 * @param color 색상 (null 불가)
 *
 * @author Palette Team
 * @since 1.0.0
 */
public record Concrete(Color color) implements ColorEntry {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException color가 null인 경우
     */
    public Concrete {
        if (color == null) {
            throw new IllegalArgumentException("color cannot be null");
        }
    }
}
