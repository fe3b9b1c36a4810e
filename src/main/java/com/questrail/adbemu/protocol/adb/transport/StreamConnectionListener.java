package com.questrail.adbemu.protocol.adb.transport;

/**
 * StreamConnectionListener
 * -----------------------------------------------------------------------------
 * Inbound side of one accepted connection, implemented by the protocol layer.
 *
 * <h2>Pull-sized reads</h2>
 * The listener states how many bytes it needs next via {@link #bytesRequired()}.
 * The transport accumulates inbound data and calls {@link #onBytes(byte[])}
 * with exactly that many bytes, as many times as the buffered data allows.
 * This lets a stream protocol with nested sub-protocols be driven without the
 * transport knowing any framing rules, and without ever blocking the event
 * loop on a partial read.
 */
public interface StreamConnectionListener
{
    /**
     * Number of bytes the next {@link #onBytes(byte[])} call must carry.
     * Always positive while {@link #isOpen()} is true.
     */
    int bytesRequired();

    /**
     * Deliver exactly {@link #bytesRequired()} bytes.
     */
    void onBytes(byte[] chunk);

    /**
     * Called once when the connection is gone (peer close, reset or shutdown).
     */
    void onClosed();

    /**
     * False once the protocol has closed or abandoned the connection; the
     * transport stops delivering bytes.
     */
    boolean isOpen();
}
