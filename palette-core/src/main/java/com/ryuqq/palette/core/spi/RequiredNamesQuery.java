package com.ryuqq.palette.core.spi;

import java.util.List;

/**
 * 팔레트에 반드시 있어야 하는 색상 이름 목록을 제공하는 SPI.
 *
 * <p>스키마 계층이 구현하며, {@link com.ryuqq.palette.core.palette.Palette#optimizedFor(RequiredNamesQuery)}가
 * 소비합니다. 이름을 결정하는 규칙은 구현체의 책임입니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface RequiredNamesQuery {

    /**
     * 필요한 색상 이름 목록.
     *
     * @return 순서가 있는 이름 목록 (null 불가)
     */
    List<String> requiredNames();
}
