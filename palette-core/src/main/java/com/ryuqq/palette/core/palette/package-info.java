/**
 * Palette construction, alias resolution and export package.
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.palette.Palette} - Immutable named color set with lazily resolved aliases</li>
 *   <li>{@link com.ryuqq.palette.core.palette.StrictCssHash} - Name to CSS hex view that fails on absent keys</li>
 *   <li>{@code PaletteResolver} - Two-pass alias chain resolution (package-private)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Map&lt;String, Object&gt; literals = new LinkedHashMap&lt;&gt;();
 * literals.put("highlights", "#f0f000");
 * literals.put("sidebarText", "highlights");
 *
 * Palette palette = Palette.fromLiterals(literals);
 * palette.get("sidebarText").toCssHex(); // "#f0f000"
 *
 * Palette small = palette.optimizedFor(() -&gt; List.of("sidebarText"));
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Single coercion point:</strong> literals become {@code Concrete} or {@code AliasName} at construction</li>
 *   <li><strong>Resolve once:</strong> the resolved mapping is memoized behind a lock on first access</li>
 *   <li><strong>All or nothing:</strong> a failed resolution caches nothing and fails the same way every time</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.palette;
