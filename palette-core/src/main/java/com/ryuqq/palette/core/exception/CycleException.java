package com.ryuqq.palette.core.exception;

/**
 * alias 체인이 같은 탐색 안에서 이미 방문한 이름을 다시 만났을 때 발생.
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class CycleException extends PaletteException {

    private final String name;

    /**
     * 생성자.
     *
     * @param name 순환이 감지된 이름
     */
    public CycleException(String name) {
        super("looping at " + name);
        this.name = name;
    }

    /**
     * 순환이 감지된 이름.
     *
     * @return 이름
     */
    public String name() {
        return name;
    }
}
