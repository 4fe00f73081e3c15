/**
 * Raw palette entry package.
 *
 * <p>{@link com.ryuqq.palette.core.entry.ColorEntry} is a sealed interface
 * (permits {@link com.ryuqq.palette.core.entry.Concrete} and
 * {@link com.ryuqq.palette.core.entry.AliasName}). A raw palette is a
 * {@code Map<String, ColorEntry>}.</p>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.entry;
