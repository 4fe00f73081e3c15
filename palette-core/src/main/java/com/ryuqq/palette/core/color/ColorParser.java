package com.ryuqq.palette.core.color;

import com.ryuqq.palette.core.entry.AliasName;
import com.ryuqq.palette.core.entry.ColorEntry;
import com.ryuqq.palette.core.entry.Concrete;

import java.util.List;

/**
 * 원시 리터럴을 {@link ColorEntry}로 변환.
 *
 * <p>팔레트 생성 시점의 유일한 변환 지점입니다. 이후 해석 단계는 값의 모양을 보고
 * 추측하지 않고 변환 결과(Concrete / AliasName)만 사용합니다.</p>
 *
 * <p><strong>변환 규칙 (순서대로 적용):</strong></p>
 * <ol>
 *   <li>{@link ColorEntry} → 그대로</li>
 *   <li>{@link Color} → Concrete</li>
 *   <li>성분 3개의 int[] 또는 List&lt;Number&gt; → Concrete(RgbColor)</li>
 *   <li>'#'으로 시작하는 문자열 → hex 파싱 → Concrete(RgbColor)</li>
 *   <li>그 외 비어있지 않은 문자열 → AliasName</li>
 *   <li>나머지 (null, 빈 문자열, 기타 타입) → IllegalArgumentException</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ColorParser parser = ColorParser.defaults();
 * parser.parse("#f0f000");          // Concrete(#f0f000)
 * parser.parse(new int[]{136, 136, 221}); // Concrete(#8888dd)
 * parser.parse("highlights");       // AliasName(highlights)
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class ColorParser {

    private static final ColorParser DEFAULTS = new ColorParser(new ColorParserConfig());

    private final ColorParserConfig config;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ColorParser(ColorParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 기본 설정 파서.
     *
     * @return 기본 ColorParser
     */
    public static ColorParser defaults() {
        return DEFAULTS;
    }

    public ColorParserConfig config() {
        return config;
    }

    /**
     * 리터럴을 ColorEntry로 변환.
     *
     * @param literal 원시 리터럴
     * @return 변환된 ColorEntry
     * @throws IllegalArgumentException 변환할 수 없는 리터럴인 경우
     */
    public ColorEntry parse(Object literal) {
        if (literal instanceof ColorEntry entry) {
            return entry;
        }
        if (literal instanceof Color color) {
            return new Concrete(color);
        }
        if (literal instanceof int[] components) {
            return new Concrete(fromComponents(components));
        }
        if (literal instanceof List<?> list) {
            return new Concrete(fromComponents(toComponents(list)));
        }
        if (literal instanceof String text) {
            if (text.isBlank()) {
                throw new IllegalArgumentException("color literal cannot be blank");
            }
            if (text.startsWith("#")) {
                return new Concrete(parseHex(text));
            }
            return new AliasName(text);
        }
        throw new IllegalArgumentException(
            "unsupported color literal: " + (literal == null ? "null" : literal.getClass().getName())
        );
    }

    /**
     * CSS hex 문자열을 RgbColor로 파싱.
     *
     * @param hex "#rrggbb" 또는 (허용 시) "#rgb"
     * @return RgbColor
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public RgbColor parseHex(String hex) {
        if (hex == null || !hex.startsWith("#")) {
            throw new IllegalArgumentException("hex color must start with '#': " + hex);
        }
        String digits = hex.substring(1);
        if (digits.length() == 3 && config.allowShortHex()) {
            digits = new String(new char[] {
                digits.charAt(0), digits.charAt(0),
                digits.charAt(1), digits.charAt(1),
                digits.charAt(2), digits.charAt(2)
            });
        }
        if (digits.length() != 6 || !digits.matches("^[0-9a-fA-F]+$")) {
            throw new IllegalArgumentException("invalid hex color: " + hex);
        }
        int value = Integer.parseInt(digits, 16);
        return RgbColor.of((value >> 16) & 0xff, (value >> 8) & 0xff, value & 0xff);
    }

    private RgbColor fromComponents(int[] components) {
        if (components.length != 3) {
            throw new IllegalArgumentException(
                "RGB literal must have exactly 3 components (current: " + components.length + ")"
            );
        }
        return RgbColor.of(component(components[0]), component(components[1]), component(components[2]));
    }

    private int component(int value) {
        if (config.clampComponents()) {
            return Math.max(0, Math.min(255, value));
        }
        return value;
    }

    private static int[] toComponents(List<?> list) {
        int[] components = new int[list.size()];
        for (int i = 0; i < components.length; i++) {
            Object item = list.get(i);
            if (!(item instanceof Number number)) {
                throw new IllegalArgumentException("RGB component must be a number: " + item);
            }
            components[i] = integralComponent(number);
        }
        return components;
    }

    // 소수이거나 int 범위를 벗어난 값은 잘리거나 넘치지 않도록 거부
    private static int integralComponent(Number number) {
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new IllegalArgumentException("RGB component must be an integer: " + number);
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("RGB component is out of int range: " + number);
        }
        return (int) value;
    }
}
