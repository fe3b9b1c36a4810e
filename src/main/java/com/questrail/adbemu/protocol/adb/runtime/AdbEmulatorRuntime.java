package com.questrail.adbemu.protocol.adb.runtime;

import com.questrail.adbemu.api.RecordingLog;
import com.questrail.adbemu.core.SynchronizedRecordingLog;
import com.questrail.adbemu.protocol.adb.codec.AdbPacketDecoder;
import com.questrail.adbemu.protocol.adb.codec.AdbPacketEncoder;
import com.questrail.adbemu.protocol.adb.codec.impl.DefaultAdbPacketDecoder;
import com.questrail.adbemu.protocol.adb.codec.impl.DefaultAdbPacketEncoder;
import com.questrail.adbemu.protocol.adb.config.AddressFamily;
import com.questrail.adbemu.protocol.adb.config.EmulatorConfig;
import com.questrail.adbemu.protocol.adb.internal.state.AdbConnection;
import com.questrail.adbemu.protocol.adb.model.SyncCommand;
import com.questrail.adbemu.protocol.adb.observability.EmulatorErrorEvent;
import com.questrail.adbemu.protocol.adb.observability.EmulatorObservabilitySink;
import com.questrail.adbemu.protocol.adb.observability.Slf4jEmulatorObservabilitySink;
import com.questrail.adbemu.protocol.adb.observability.TransportObservabilityEvent;
import com.questrail.adbemu.protocol.adb.transport.StreamConnection;
import com.questrail.adbemu.protocol.adb.transport.StreamConnectionListener;
import com.questrail.adbemu.protocol.adb.transport.StreamEndpoint;
import com.questrail.adbemu.protocol.adb.transport.StreamEndpointListener;
import com.questrail.adbemu.protocol.adb.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AdbEmulatorRuntime
 * =============================================================================
 * Lifecycle controller and composition root of the emulated daemon.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It
 * binds the transport, creates one {@link AdbConnection} per accepted
 * connection and owns the two recording logs that tests inspect.
 *
 * <p><strong>No protocol semantics live here.</strong> Everything a connection
 * does with its bytes is decided by {@link AdbConnection} and the sync session
 * it hosts.</p>
 *
 * <h2>Typical use</h2>
 * <pre>
 *   try (AdbEmulatorRuntime emulator = AdbEmulatorRuntime.start(AddressFamily.IPV4)) {
 *       runClientAgainst(emulator.port());
 *       assertEquals(List.of("shell:ls"), emulator.commandLog().snapshot());
 *   }
 * </pre>
 *
 * <h2>Threading</h2>
 * {@link #start()} and {@link #stop()} may be called from any thread. All
 * connection work happens on the transport's single event-loop thread; the
 * recording logs are safe to read from any thread while it runs.
 */
public final class AdbEmulatorRuntime implements AutoCloseable
{
    private final EmulatorConfig config;
    private final StreamEndpoint endpoint;
    private final EmulatorObservabilitySink observabilitySink;
    private final AdbPacketEncoder encoder;
    private final AdbPacketDecoder decoder;
    private final RecordingLog<String> commandLog = new SynchronizedRecordingLog<>();
    private final RecordingLog<SyncCommand> syncCommandLog = new SynchronizedRecordingLog<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile InetSocketAddress localAddress;

    AdbEmulatorRuntime(EmulatorConfig config,
                       StreamEndpoint endpoint,
                       EmulatorObservabilitySink observabilitySink,
                       AdbPacketEncoder encoder,
                       AdbPacketDecoder decoder)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");

        this.endpoint.setListener(new Listener());
    }

    /**
     * Start an emulator with default configuration on an ephemeral loopback
     * port of the given family.
     */
    public static AdbEmulatorRuntime start(AddressFamily addressFamily)
    {
        return builder()
                .withConfig(EmulatorConfig.builder().withAddressFamily(addressFamily).build())
                .start();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Bind and begin accepting. Returns once the listener is bound.
     *
     * @throws com.questrail.adbemu.protocol.adb.transport.EmulatorTransportException if the bind fails
     */
    void startEndpoint()
    {
        localAddress = endpoint.start();
    }

    /**
     * Close the listener and every connection and wait for the event loop to
     * terminate. Subsequent calls are no-ops.
     */
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        endpoint.stop();
    }

    @Override
    public void close()
    {
        stop();
    }

    /**
     * The port actually bound; meaningful after start, including for an
     * ephemeral request.
     */
    public int port()
    {
        return localAddress.getPort();
    }

    public InetSocketAddress localAddress()
    {
        return localAddress;
    }

    public EmulatorConfig config()
    {
        return config;
    }

    /**
     * Destinations of every OPEN received, in arrival order.
     */
    public RecordingLog<String> commandLog()
    {
        return commandLog;
    }

    /**
     * Every sync request received, in arrival order.
     */
    public RecordingLog<SyncCommand> syncCommandLog()
    {
        return syncCommandLog;
    }

    public boolean isStopped()
    {
        return stopped.get();
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements StreamEndpointListener
    {
        @Override
        public void onTransportUp(InetSocketAddress local)
        {
            observabilitySink.onTransportEvent(
                    new TransportObservabilityEvent.Listening(Instant.now(), local));
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            observabilitySink.onTransportEvent(
                    new TransportObservabilityEvent.Stopped(Instant.now(), cause));
        }

        @Override
        public StreamConnectionListener onConnectionAccepted(String connectionId, StreamConnection connection)
        {
            observabilitySink.onTransportEvent(
                    new TransportObservabilityEvent.ConnectionAccepted(Instant.now(), connectionId));

            AdbConnection adbConnection = new AdbConnection(
                    connectionId,
                    connection,
                    config,
                    encoder,
                    decoder,
                    commandLog,
                    syncCommandLog,
                    observabilitySink);
            adbConnection.sendGreeting();
            return new ClosingConnectionListener(connectionId, adbConnection);
        }

        @Override
        public void onConnectionError(String connectionId, Throwable cause)
        {
            observabilitySink.onError(new EmulatorErrorEvent(
                    Instant.now(), "Connection " + connectionId + " failed", cause));
        }
    }

    /**
     * Reports the close of a connection to the sink once the protocol layer has seen it.
     */
    private final class ClosingConnectionListener implements StreamConnectionListener
    {
        private final String connectionId;
        private final AdbConnection delegate;

        ClosingConnectionListener(String connectionId, AdbConnection delegate)
        {
            this.connectionId = connectionId;
            this.delegate = delegate;
        }

        @Override
        public int bytesRequired()
        {
            return delegate.bytesRequired();
        }

        @Override
        public void onBytes(byte[] chunk)
        {
            delegate.onBytes(chunk);
        }

        @Override
        public void onClosed()
        {
            delegate.onClosed();
            observabilitySink.onTransportEvent(
                    new TransportObservabilityEvent.ConnectionClosed(Instant.now(), connectionId));
        }

        @Override
        public boolean isOpen()
        {
            return delegate.isOpen();
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private EmulatorConfig config = EmulatorConfig.defaults();
        private EmulatorObservabilitySink observabilitySink = new Slf4jEmulatorObservabilitySink();
        private StreamEndpoint endpoint;

        private Builder() {}

        public Builder withConfig(EmulatorConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObservabilitySink(EmulatorObservabilitySink observabilitySink)
        {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        /**
         * Replace the Netty transport; intended for tests.
         */
        Builder withEndpoint(StreamEndpoint endpoint)
        {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        /**
         * Build, bind and start accepting connections.
         */
        public AdbEmulatorRuntime start()
        {
            StreamEndpoint e = (endpoint != null)
                    ? endpoint
                    : new NettyTcpStreamEndpoint(
                            new InetSocketAddress(config.addressFamily().loopbackAddress(), config.port()),
                            config.shutdownTimeout());

            AdbEmulatorRuntime runtime = new AdbEmulatorRuntime(
                    config,
                    e,
                    observabilitySink,
                    new DefaultAdbPacketEncoder(),
                    new DefaultAdbPacketDecoder());
            runtime.startEndpoint();
            return runtime;
        }
    }
}
