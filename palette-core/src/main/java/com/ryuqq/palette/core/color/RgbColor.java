package com.ryuqq.palette.core.color;

/**
 * RGB 세 성분으로 표현되는 기본 {@link Color} 구현.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> 각 성분은 0~255</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class RgbColor implements Color {

    private final int red;
    private final int green;
    private final int blue;

    private RgbColor(int red, int green, int blue) {
        requireComponent("red", red);
        requireComponent("green", green);
        requireComponent("blue", blue);
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    /**
     * RgbColor 생성.
     *
     * @param red 빨강 (0~255)
     * @param green 초록 (0~255)
     * @param blue 파랑 (0~255)
     * @return RgbColor 인스턴스
     * @throws IllegalArgumentException 성분이 범위를 벗어난 경우
     */
    public static RgbColor of(int red, int green, int blue) {
        return new RgbColor(red, green, blue);
    }

    public int red() {
        return red;
    }

    public int green() {
        return green;
    }

    public int blue() {
        return blue;
    }

    /**
     * 소문자 6자리 hex 표현.
     *
     * @return "#rrggbb"
     */
    @Override
    public String toCssHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }

    private static void requireComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(
                name + " component must be between 0 and 255 (current: " + value + ")"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RgbColor that = (RgbColor) o;
        return red == that.red && green == that.green && blue == that.blue;
    }

    @Override
    public int hashCode() {
        return (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toString() {
        return "RgbColor{" + toCssHex() + '}';
    }
}
