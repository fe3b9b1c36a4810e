package com.questrail.adbemu.protocol.adb.observability;

/**
 * No-op implementation of EmulatorObservabilitySink.
 */
public final class NullObservabilitySink implements EmulatorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(EmulatorErrorEvent event) {}
}
