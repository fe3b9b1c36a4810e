package com.questrail.adbemu.protocol.adb.observability;

/**
 * Main interface for receiving emulator observability events.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Except for transport up/down, events are delivered on the emulator's
 * event-loop thread; implementations must not block.</p>
 */
public interface EmulatorObservabilitySink {
    /**
     * Called when a connection changes protocol state.
     * @param event the transition event details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (command recorded, packet ignored).
     * @param event the protocol event
     */
    void onProtocolEvent(ProtocolObservabilityEvent event);

    /**
     * Called when a transport-level event occurs (listener up, connection accepted).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an unexpected error occurs.
     * @param event the error event
     */
    void onError(EmulatorErrorEvent event);
}
