package com.ryuqq.palette.core.exception;

/**
 * alias 체인이 원본 엔트리에 없는 이름을 가리킬 때 발생.
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class MissingReferenceException extends PaletteException {

    private final String key;
    private final String missingName;

    /**
     * 생성자.
     *
     * @param key 해석을 시작한 엔트리 이름
     * @param missingName 찾을 수 없는 대상 이름
     */
    public MissingReferenceException(String key, String missingName) {
        super(String.format("%s refers to missing color %s", key, missingName));
        this.key = key;
        this.missingName = missingName;
    }

    /**
     * 해석을 시작한 엔트리 이름.
     *
     * @return 엔트리 이름
     */
    public String key() {
        return key;
    }

    /**
     * 찾을 수 없는 대상 이름.
     *
     * @return 대상 이름
     */
    public String missingName() {
        return missingName;
    }
}
