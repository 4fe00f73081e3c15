package com.ryuqq.palette.core.color;

/**
 * ColorParser 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>allowShortHex: "#rgb" 3자리 hex 허용 여부 (기본 true, "#333" → "#333333")</li>
 *   <li>clampComponents: 범위를 벗어난 RGB 성분을 0~255로 보정할지 여부 (기본 false, false면 거부)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param allowShortHex 3자리 hex 허용 여부
 * @param clampComponents RGB 성분 보정 여부
 */
public record ColorParserConfig(boolean allowShortHex, boolean clampComponents) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: allowShortHex=true, clampComponents=false</p>
     */
    public ColorParserConfig() {
        this(true, false);
    }

    /**
     * allowShortHex만 변경한 새 인스턴스 생성.
     *
     * @param allowShortHex 3자리 hex 허용 여부
     * @return 새 ColorParserConfig 인스턴스
     */
    public ColorParserConfig withAllowShortHex(boolean allowShortHex) {
        return new ColorParserConfig(allowShortHex, this.clampComponents);
    }

    /**
     * clampComponents만 변경한 새 인스턴스 생성.
     *
     * @param clampComponents RGB 성분 보정 여부
     * @return 새 ColorParserConfig 인스턴스
     */
    public ColorParserConfig withClampComponents(boolean clampComponents) {
        return new ColorParserConfig(this.allowShortHex, clampComponents);
    }
}
