/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.spi.RequiredNamesQuery} - Supplies the color names a consumer requires</li>
 * </ul>
 *
 * <p>The palette-schema module provides the reference implementation.</p>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.spi;
