/**
 * Frame Codec
 * =============================================================================
 *
 * <p>Wire-level envelope shared by requests and responses:</p>
 *
 * <pre>
 *   +------+------+---------+-------------------+-----------------+
 *   | 0xF0 | 0x0D | version |  length (u32 BE)  | payload bytes   |
 *   +------+------+---------+-------------------+-----------------+
 *      magic (2)     (1)          (4)               (length)
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   socket bytes
 *        → FrameDecoder          (magic, version, length validated here)
 *            → payload bytes
 *                → PayloadCodec  (JSON request/response)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The payload is opaque at this layer. A vendor-specific codec can be
 *       plugged in above without touching framing.</li>
 *   <li>A frame whose magic, version or declared length is invalid is rejected
 *       before any payload byte is interpreted.</li>
 *   <li>The decoder keeps no state; partial reads are the caller's concern.</li>
 * </ul>
 */
package com.questrail.devicelink.protocol.codec;
