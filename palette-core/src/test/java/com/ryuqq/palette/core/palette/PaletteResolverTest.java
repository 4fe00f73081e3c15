package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.color.Color;
import com.ryuqq.palette.core.color.RgbColor;
import com.ryuqq.palette.core.entry.ColorEntry;
import com.ryuqq.palette.core.exception.CycleException;
import com.ryuqq.palette.core.exception.MissingReferenceException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PaletteResolver 2-pass 해석 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class PaletteResolverTest {

    @Test
    void resolve_KeepsInputOrder_EvenWhenAliasesComeFirst() {
        // Given
        Map<String, ColorEntry> raw = new LinkedHashMap<>();
        raw.put("z", ColorEntry.alias("y"));
        raw.put("y", ColorEntry.alias("x"));
        raw.put("x", ColorEntry.concrete(RgbColor.of(9, 9, 9)));

        // When
        Map<String, Color> resolved = PaletteResolver.resolve(raw);

        // Then
        assertThat(resolved).containsOnlyKeys("z", "y", "x");
        assertThat(resolved.keySet()).containsExactly("z", "y", "x");
        assertThat(resolved.get("z")).isSameAs(resolved.get("x"));
    }

    @Test
    void resolve_LongChain_EveryLinkSharesTheAnchorColor() {
        // Given
        Color anchor = RgbColor.of(1, 2, 3);
        Map<String, ColorEntry> raw = new LinkedHashMap<>();
        for (int i = 50; i > 0; i--) {
            raw.put("c" + i, ColorEntry.alias("c" + (i - 1)));
        }
        raw.put("c0", ColorEntry.concrete(anchor));

        // When
        Map<String, Color> resolved = PaletteResolver.resolve(raw);

        // Then
        assertThat(resolved).hasSize(51);
        assertThat(resolved.values()).allSatisfy(color -> assertThat(color).isSameAs(anchor));
    }

    @Test
    void resolve_CycleBehindValidPrefix_ThrowsCycleException() {
        // Given - start → loopA ⇄ loopB
        Map<String, ColorEntry> raw = new LinkedHashMap<>();
        raw.put("start", ColorEntry.alias("loopA"));
        raw.put("loopA", ColorEntry.alias("loopB"));
        raw.put("loopB", ColorEntry.alias("loopA"));

        // When & Then
        assertThatThrownBy(() -> PaletteResolver.resolve(raw))
            .isInstanceOfSatisfying(CycleException.class, e -> assertThat(e.name()).isEqualTo("loopA"));
    }

    @Test
    void resolve_MissingTarget_NamesKeyAndTarget() {
        // Given
        Map<String, ColorEntry> raw = new LinkedHashMap<>();
        raw.put("ok", ColorEntry.concrete(RgbColor.of(0, 0, 0)));
        raw.put("broken", ColorEntry.alias("ghost"));

        // When & Then
        assertThatThrownBy(() -> PaletteResolver.resolve(raw))
            .isInstanceOfSatisfying(MissingReferenceException.class, e -> {
                assertThat(e.key()).isEqualTo("broken");
                assertThat(e.missingName()).isEqualTo("ghost");
            });
    }

    @Test
    void resolve_ResultIsUnmodifiable() {
        // Given
        Map<String, ColorEntry> raw = Map.of("a", ColorEntry.concrete(RgbColor.of(0, 0, 0)));

        // When
        Map<String, Color> resolved = PaletteResolver.resolve(raw);

        // Then
        assertThatThrownBy(() -> resolved.remove("a")).isInstanceOf(UnsupportedOperationException.class);
    }
}
