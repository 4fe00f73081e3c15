package com.ryuqq.palette.core.exception;

/**
 * Strict CSS 해시에서 존재하지 않는 키를 조회할 때 발생.
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class StrictLookupException extends PaletteException {

    private final String key;

    public StrictLookupException(String key) {
        super("no entry in palette hash for key " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
