package com.questrail.adbemu.protocol.adb.transport;

/**
 * Indicates that a transport endpoint could not be brought up, typically
 * because the requested address could not be bound.
 */
public final class EmulatorTransportException extends RuntimeException
{
    public EmulatorTransportException(String message) {
        super(message);
    }

    public EmulatorTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
