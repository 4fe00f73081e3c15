/**
 * Palette schema package.
 *
 * <p>Provides {@link com.ryuqq.palette.schema.PaletteSchema}, the reference implementation of
 * {@link com.ryuqq.palette.core.spi.RequiredNamesQuery}. A schema names the colors an
 * application expects; a palette can be checked against it or reduced to exactly those colors.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PaletteSchema schema = PaletteSchema.of("highlights", "sidebarText");
 * if (!schema.isSatisfiedBy(palette)) {
 *     throw new IllegalStateException("missing colors: " + schema.missingNames(palette));
 * }
 * Palette embedded = schema.optimize(palette);
 * </pre>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.schema;
