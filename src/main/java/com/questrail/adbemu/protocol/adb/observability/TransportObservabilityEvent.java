package com.questrail.adbemu.protocol.adb.observability;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Transport lifecycle events (listener up/down, connections accepted/closed).
 */
public sealed interface TransportObservabilityEvent
        permits TransportObservabilityEvent.Listening,
                TransportObservabilityEvent.ConnectionAccepted,
                TransportObservabilityEvent.ConnectionClosed,
                TransportObservabilityEvent.Stopped
{
    Instant timestamp();

    record Listening(Instant timestamp, InetSocketAddress localAddress)
            implements TransportObservabilityEvent {}

    record ConnectionAccepted(Instant timestamp, String connectionId)
            implements TransportObservabilityEvent {}

    record ConnectionClosed(Instant timestamp, String connectionId)
            implements TransportObservabilityEvent {}

    /** @param cause failure that brought the transport down, or null for orderly stop */
    record Stopped(Instant timestamp, Throwable cause)
            implements TransportObservabilityEvent {}
}
