package com.questrail.adbemu.protocol.adb.transport;

import java.net.InetSocketAddress;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a listening, stream-based transport (TCP-style).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>creating a per-connection state machine when a connection is accepted</li>
 *   <li>interpreting the bytes handed to that state machine</li>
 *   <li>deciding what to write back</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Bind the listening socket and begin accepting connections.
     *
     * <p>Returns only once the listener is bound and accepting, so a caller may
     * connect immediately. On success the listener is notified via
     * {@link StreamEndpointListener#onTransportUp(InetSocketAddress)}.</p>
     *
     * @return the bound local address (with the actual port when 0 was requested)
     * @throws EmulatorTransportException if the address cannot be bound
     */
    InetSocketAddress start();

    /**
     * Close the listener and every accepted connection, then release the event
     * loop. Blocks until all sockets are closed.
     *
     * <p>Idempotent. The listener is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Register the listener that receives accepted connections and lifecycle
     * events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);
}
