/**
 * REST API layer: controllers and DTOs.
 *
 * <p>Exposes the proof analysis engine through REST endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/proofs/analyze} - full or thought-type analysis</li>
 *   <li>{@code POST /api/v1/proofs/report} - full analysis with a Markdown report</li>
 *   <li>{@code GET /api/v1/proofs/stats} - enabled passes and version</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.proofengine.api;
