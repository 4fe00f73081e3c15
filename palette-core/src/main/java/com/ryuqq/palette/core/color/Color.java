package com.ryuqq.palette.core.color;

/**
 * 팔레트가 다루는 구체 색상.
 *
 * <p>팔레트는 색상의 의미(혼합, 대비, 색공간 변환 등)를 해석하지 않으며,
 * CSS 텍스트 표현만 사용합니다. alias 해석 결과는 동일한 Color 인스턴스를
 * 공유하므로 값 동등성은 요구하지 않습니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface Color {

    /**
     * CSS hex 표현 조회.
     *
     * <p>구현체의 정규 표현을 그대로 사용하며 팔레트는 추가로 정규화하지 않습니다.</p>
     *
     * @return CSS hex 문자열 (예: "#f0f000")
     */
    String toCssHex();
}
