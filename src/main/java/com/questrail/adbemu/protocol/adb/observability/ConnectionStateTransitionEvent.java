package com.questrail.adbemu.protocol.adb.observability;

import com.questrail.adbemu.protocol.adb.internal.state.ConnectionState;

import java.time.Instant;

/**
 * Record representing a state transition of one emulated connection.
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    String connectionId,
    ConnectionState oldState,
    ConnectionState newState
) {
    public boolean isTerminal() {
        return newState == ConnectionState.CLOSED;
    }
}
