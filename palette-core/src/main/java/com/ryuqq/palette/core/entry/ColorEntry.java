package com.ryuqq.palette.core.entry;

import com.ryuqq.palette.core.color.Color;

/**
 * 팔레트 원본 엔트리의 값.
 *
 * <p>ColorEntry는 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Concrete}: 구체 색상</li>
 *   <li>{@link AliasName}: 같은 팔레트의 다른 엔트리 이름</li>
 * </ul>
 *
 * <p>변환은 팔레트 생성 시점에 한 번만 이루어지므로, "색상처럼 보이는 문자열"과
 * "alias 이름"이 해석 단계에서 혼동되지 않습니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public sealed interface ColorEntry permits Concrete, AliasName {

    /**
     * 구체 색상 엔트리 생성.
     *
     * @param color 색상
     * @return Concrete 인스턴스
     */
    static ColorEntry concrete(Color color) {
        return new Concrete(color);
    }

    /**
     * alias 엔트리 생성.
     *
     * @param target 대상 엔트리 이름
     * @return AliasName 인스턴스
     */
    static ColorEntry alias(String target) {
        return new AliasName(target);
    }

    default boolean isConcrete() {
        return this instanceof Concrete;
    }

    default boolean isAlias() {
        return this instanceof AliasName;
    }
}
