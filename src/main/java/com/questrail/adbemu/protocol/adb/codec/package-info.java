/**
 * Connection-layer codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the emulated
 * daemon's connection-layer protocol: a fixed 24-byte little-endian header
 * optionally followed by a payload.</p>
 *
 * <pre>
 *   command | arg0 | arg1 | data_length | reserved (0) | checksum (command ^ 0xFFFFFFFF)
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> the connection state machine and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte[] from connection
 *        → AdbPacketDecoder      (header fields extracted here)
 *            → AdbHeader
 *                → AdbConnection (dispatch)
 *                    → AdbPacket → AdbPacketEncoder → byte[] to connection
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No checksum validation on the inbound path.</li>
 *   <li>No payload reads; the state machine asks the transport for exactly
 *       {@code data_length} bytes after a header.</li>
 *   <li>Sync sub-protocol frames are handled by
 *       {@code com.questrail.adbemu.protocol.adb.sync.SyncFrames}, not here.</li>
 * </ul>
 */
package com.questrail.adbemu.protocol.adb.codec;
