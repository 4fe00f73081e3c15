package com.ryuqq.palette.core.exception;

/**
 * 팔레트 처리 중 발생하는 오류의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 unchecked이며, 라이브러리 내부에서 복구하거나 로깅하지 않고
 * 호출자에게 그대로 전파됩니다.</p>
 *
 * <ul>
 *   <li>{@link MissingReferenceException}: alias가 존재하지 않는 이름을 참조</li>
 *   <li>{@link CycleException}: alias 체인이 순환</li>
 *   <li>{@link UnknownColorException}: 해석된 팔레트에 없는 이름 조회</li>
 *   <li>{@link StrictLookupException}: strict CSS 해시에 없는 키 조회</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public abstract class PaletteException extends RuntimeException {

    protected PaletteException(String message) {
        super(message);
    }
}
