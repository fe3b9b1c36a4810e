package com.questrail.adbemu.protocol.adb.transport;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * Outbound side of one accepted connection.
 *
 * <p>Writes are queued in call order. Calls after the connection closed are
 * silently dropped; the inbound side learns about the close through
 * {@link StreamConnectionListener#onClosed()}.</p>
 */
public interface StreamConnection
{
    void write(byte[] bytes);

    /**
     * Close the connection. Idempotent.
     */
    void close();
}
