package com.questrail.adbemu.protocol.adb.transport;

import java.net.InetSocketAddress;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>All callbacks for accepted connections are delivered on the endpoint's
 * single event-loop thread. {@link #onTransportUp(InetSocketAddress)} and
 * {@link #onTransportDown(Throwable)} are delivered on the thread that called
 * {@code start()} / {@code stop()}.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called once the listening socket is bound.
     */
    void onTransportUp(InetSocketAddress localAddress);

    /**
     * Called when the endpoint stops or fails to start.
     *
     * @param cause the failure; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a connection is accepted.
     *
     * @param connectionId diagnostic identifier of the connection
     * @param connection   outbound side of the accepted connection
     * @return the listener that consumes the connection's inbound bytes
     */
    StreamConnectionListener onConnectionAccepted(String connectionId, StreamConnection connection);

    /**
     * Called when a connection fails with something other than an orderly or
     * abrupt close. The connection is closed afterwards.
     */
    void onConnectionError(String connectionId, Throwable cause);
}
