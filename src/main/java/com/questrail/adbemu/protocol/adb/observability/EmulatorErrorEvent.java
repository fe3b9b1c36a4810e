package com.questrail.adbemu.protocol.adb.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error inside the emulator.
 */
public record EmulatorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
