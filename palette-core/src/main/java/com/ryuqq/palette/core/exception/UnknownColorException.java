package com.ryuqq.palette.core.exception;

/**
 * 해석된 팔레트에 존재하지 않는 색상 이름을 조회할 때 발생.
 *
 * <p>스키마 검증 실패도 이 예외로 표현됩니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class UnknownColorException extends PaletteException {

    private final String name;

    public UnknownColorException(String name) {
        super("no color named " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
