/**
 * Color capability and literal coercion package.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.color.Color} - Opaque color exposing a CSS hex rendering</li>
 *   <li>{@link com.ryuqq.palette.core.color.RgbColor} - Default immutable RGB implementation</li>
 *   <li>{@link com.ryuqq.palette.core.color.ColorParser} - Coerces raw literals into color entries</li>
 *   <li>{@link com.ryuqq.palette.core.color.ColorParserConfig} - Parser configuration</li>
 * </ul>
 *
 * <h2>Accepted Literals</h2>
 * <ul>
 *   <li>{@code "#rrggbb"} / {@code "#rgb"} hex triples</li>
 *   <li>{@code int[]} or {@code List<Number>} with three RGB components</li>
 *   <li>Any {@link com.ryuqq.palette.core.color.Color} instance</li>
 *   <li>Any other string, taken as the name of another entry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.color;
