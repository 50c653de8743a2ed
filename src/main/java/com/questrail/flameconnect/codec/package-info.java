/**
 * FlameConnect Codec — Public Ports
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the
 * FlameConnect binary parameter protocol: the decode and encode ports, the
 * typed error taxonomy and the result type they return.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> the exchange layer (base64 wire
 * entries, batch handling, logging) and has no transport of its own:</p>
 *
 * <pre>
 *   { ParameterId, Value(base64) }
 *        → exchange: base64 decode
 *            → ParameterDecoder   (wire rules applied here)
 *                → Parameter
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec consumes and produces raw bytes only.</li>
 *   <li>The codec never logs and never throws for wire-level defects;
 *       it returns {@link com.questrail.flameconnect.codec.ProtocolError}
 *       values inside a {@link com.questrail.flameconnect.codec.CodecResult}.</li>
 *   <li>All functions are pure and safe to call concurrently.</li>
 * </ul>
 */
package com.questrail.flameconnect.codec;
