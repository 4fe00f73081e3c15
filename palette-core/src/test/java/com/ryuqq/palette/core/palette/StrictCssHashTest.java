package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.exception.StrictLookupException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StrictCssHash 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class StrictCssHashTest {

    private Palette palette() {
        Map<String, Object> literals = new LinkedHashMap<>();
        literals.put("a", "#112233");
        literals.put("b", "a");
        return Palette.fromLiterals(literals);
    }

    @Test
    void get_PresentKey_ReturnsSameValueAsCssHash() {
        // Given
        Palette palette = palette();

        // When
        StrictCssHash strict = palette.asStrictCssHash();

        // Then
        for (String name : palette.names()) {
            assertThat(strict.get(name)).isEqualTo(palette.asCssHash().get(name));
        }
        assertThat(strict.toMap()).isEqualTo(palette.asCssHash());
        assertThat(strict.names()).containsExactly("a", "b");
        assertThat(strict.size()).isEqualTo(2);
    }

    @Test
    void get_AbsentKey_ThrowsStrictLookupException() {
        // Given
        StrictCssHash strict = palette().asStrictCssHash();

        // When & Then
        assertThatThrownBy(() -> strict.get("z"))
            .isInstanceOfSatisfying(StrictLookupException.class, e -> assertThat(e.key()).isEqualTo("z"))
            .hasMessage("no entry in palette hash for key z");
        assertThat(strict.containsKey("z")).isFalse();
    }

    @Test
    void toMap_IsReadOnly() {
        // Given
        StrictCssHash strict = palette().asStrictCssHash();

        // When & Then
        assertThatThrownBy(() -> strict.toMap().put("z", "#000000"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equals_SameContent_ReturnsTrue() {
        // When & Then
        assertThat(palette().asStrictCssHash()).isEqualTo(palette().asStrictCssHash());
        assertThat(palette().asStrictCssHash().hashCode()).isEqualTo(palette().asStrictCssHash().hashCode());
    }
}
