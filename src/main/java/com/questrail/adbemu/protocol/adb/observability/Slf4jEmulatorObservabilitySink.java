package com.questrail.adbemu.protocol.adb.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EmulatorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEmulatorObservabilitySink implements EmulatorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEmulatorObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        log.debug("Connection {}: {} -> {}",
            event.connectionId(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {
        if (event instanceof ProtocolObservabilityEvent.CommandRecorded recorded) {
            log.info("Connection {}: OPEN '{}'", recorded.connectionId(), recorded.destination());
        }
        else if (event instanceof ProtocolObservabilityEvent.SyncRequestRecorded recorded) {
            log.info("Connection {}: sync {}", recorded.connectionId(), recorded.command());
        }
        else if (event instanceof ProtocolObservabilityEvent.MalformedInput malformed) {
            log.warn("Connection {}: malformed input ({})", malformed.connectionId(), malformed.reason());
        }
        else {
            log.debug("Protocol Event: {}", event);
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event instanceof TransportObservabilityEvent.Listening listening) {
            log.info("Emulated daemon listening on {}", listening.localAddress());
        }
        else if (event instanceof TransportObservabilityEvent.Stopped stopped && stopped.cause() != null) {
            log.warn("Emulated daemon stopped: {}", stopped.cause().toString());
        }
        else {
            log.debug("Transport Event: {}", event);
        }
    }

    @Override
    public void onError(EmulatorErrorEvent event) {
        log.error("Emulator Error: {}", event.message(), event.cause());
    }
}
