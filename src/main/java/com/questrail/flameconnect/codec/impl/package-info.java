/**
 * FlameConnect Codec — Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete codec that bridges raw parameter
 * frames and the semantic {@link com.questrail.flameconnect.model.Parameter}
 * model.</p>
 *
 * <h2>Frame layout</h2>
 * <pre>
 *   [ id lo ][ id hi ][ payload length ][ payload ... ]
 *        FrameHeader                      FrameReader / FrameWriter
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty buffer types are used for little-endian field access and MUST NOT
 * escape this package. The public surface is {@code byte[]} in and out.
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>transport-agnostic</li>
 *   <li>stateless</li>
 *   <li>free of logging</li>
 * </ul>
 */
package com.questrail.flameconnect.codec.impl;
