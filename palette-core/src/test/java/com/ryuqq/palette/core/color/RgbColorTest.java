package com.ryuqq.palette.core.color;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RgbColor 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class RgbColorTest {

    @Test
    void toCssHex_RendersLowercaseSixDigits() {
        // Given
        RgbColor color = RgbColor.of(240, 240, 0);

        // When
        String hex = color.toCssHex();

        // Then
        assertThat(hex).isEqualTo("#f0f000");
    }

    @Test
    void toCssHex_PadsSmallComponents() {
        // When & Then
        assertThat(RgbColor.of(1, 2, 3).toCssHex()).isEqualTo("#010203");
        assertThat(RgbColor.of(0, 0, 0).toCssHex()).isEqualTo("#000000");
    }

    @Test
    void of_ComponentOutOfRange_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> RgbColor.of(256, 0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("red");
        assertThatThrownBy(() -> RgbColor.of(0, -1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("green");
    }

    @Test
    void equals_SameComponents_ReturnsTrue() {
        // Given
        RgbColor first = RgbColor.of(17, 34, 51);
        RgbColor second = RgbColor.of(17, 34, 51);

        // When & Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first).isNotEqualTo(RgbColor.of(17, 34, 52));
    }
}
