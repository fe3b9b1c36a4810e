package com.questrail.adbemu.protocol.adb.internal.state;

/**
 * Protocol-level state of one emulated connection.
 *
 * <pre>
 *   INIT → HANDSHAKE_SENT ⇄ IN_SYNC
 *     └──────────┴───────────┴──→ CLOSED
 * </pre>
 *
 * {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    /** Accepted; connect greeting not yet written. */
    INIT,
    /** Greeting written; reading connection-layer packets. */
    HANDSHAKE_SENT,
    /** A {@code sync:} stream is open; reading sync requests. */
    IN_SYNC,
    CLOSED
}
