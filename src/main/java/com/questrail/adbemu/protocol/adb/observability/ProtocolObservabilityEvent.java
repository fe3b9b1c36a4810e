package com.questrail.adbemu.protocol.adb.observability;

import com.questrail.adbemu.protocol.adb.model.SyncCommand;

import java.time.Instant;

/**
 * Protocol-level events emitted by the connection state machine.
 */
public sealed interface ProtocolObservabilityEvent
        permits ProtocolObservabilityEvent.CommandRecorded,
                ProtocolObservabilityEvent.SyncRequestRecorded,
                ProtocolObservabilityEvent.PacketIgnored,
                ProtocolObservabilityEvent.MalformedInput
{
    Instant timestamp();

    String connectionId();

    /** An OPEN destination was appended to the command log. */
    record CommandRecorded(Instant timestamp, String connectionId, String destination)
            implements ProtocolObservabilityEvent {}

    /** A sync request was appended to the sync command log. */
    record SyncRequestRecorded(Instant timestamp, String connectionId, SyncCommand command)
            implements ProtocolObservabilityEvent {}

    /** A connection-layer packet with no behavior in this emulator. */
    record PacketIgnored(Instant timestamp, String connectionId, String commandTag)
            implements ProtocolObservabilityEvent {}

    /** Input that could not be framed; the connection or session is dropped. */
    record MalformedInput(Instant timestamp, String connectionId, String reason)
            implements ProtocolObservabilityEvent {}
}
