/**
 * REST API layer.
 *
 * <ul>
 *   <li>{@code GET /badge} - SVG activity badge, served stale-while-revalidate</li>
 *   <li>{@code GET /health} - liveness and configuration presence</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.genki.api;
