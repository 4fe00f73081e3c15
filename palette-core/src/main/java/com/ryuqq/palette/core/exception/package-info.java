/**
 * Palette error types.
 *
 * <p>All errors are unchecked and share {@link com.ryuqq.palette.core.exception.PaletteException}
 * as their base. The library never recovers from, retries or logs them; they surface
 * synchronously to the caller of the operation that triggered them.</p>
 *
 * <h2>Error Kinds</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.exception.MissingReferenceException} - Alias target absent from the raw entries</li>
 *   <li>{@link com.ryuqq.palette.core.exception.CycleException} - Alias chain revisits a name</li>
 *   <li>{@link com.ryuqq.palette.core.exception.UnknownColorException} - Lookup of a name the palette does not define</li>
 *   <li>{@link com.ryuqq.palette.core.exception.StrictLookupException} - Strict CSS hash queried for an absent key</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.exception;
