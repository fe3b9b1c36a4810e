package com.questrail.adbemu.protocol.adb.internal.state;

import com.questrail.adbemu.api.RecordingLog;
import com.questrail.adbemu.protocol.adb.codec.AdbPacketDecoder;
import com.questrail.adbemu.protocol.adb.codec.AdbPacketEncoder;
import com.questrail.adbemu.protocol.adb.codec.impl.AdbWireFormat;
import com.questrail.adbemu.protocol.adb.config.EmulatorConfig;
import com.questrail.adbemu.protocol.adb.internal.frame.AdbHeader;
import com.questrail.adbemu.protocol.adb.model.AdbCommand;
import com.questrail.adbemu.protocol.adb.model.AdbPacket;
import com.questrail.adbemu.protocol.adb.model.SyncCommand;
import com.questrail.adbemu.protocol.adb.model.WireTags;
import com.questrail.adbemu.protocol.adb.observability.ConnectionStateTransitionEvent;
import com.questrail.adbemu.protocol.adb.observability.EmulatorObservabilitySink;
import com.questrail.adbemu.protocol.adb.observability.ProtocolObservabilityEvent;
import com.questrail.adbemu.protocol.adb.sync.SyncSession;
import com.questrail.adbemu.protocol.adb.transport.StreamConnection;
import com.questrail.adbemu.protocol.adb.transport.StreamConnectionListener;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * AdbConnection
 * =============================================================================
 * Connection state machine of the emulated daemon, one instance per accepted
 * connection.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   INIT ──greeting──→ HANDSHAKE_SENT ──OPEN "sync:"──→ IN_SYNC
 *                            ↑                              │
 *                            └──── QUIT / FAIL ─────────────┘
 *   any state ──close / reset / malformed header──→ CLOSED
 * </pre>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   transport chunk (exactly bytesRequired())
 *        → AdbPacketDecoder            (24-byte header)
 *            → payload chunk            (exactly data_length bytes, if any)
 *                → dispatch by command
 *                    → OPEN: record, reply OKAY, maybe start SyncSession
 *                    → anything else: ignored
 * </pre>
 *
 * <h2>Ordering guarantee</h2>
 * The command log entry of an OPEN is appended before its OKAY is written.
 *
 * <h2>Threading</h2>
 * Not thread-safe; every method is invoked on the transport's event-loop thread.
 */
public final class AdbConnection implements StreamConnectionListener
{
    /** Destination that opens the file-transfer sub-protocol. */
    public static final String SYNC_SERVICE = "sync:";

    private final String connectionId;
    private final StreamConnection connection;
    private final EmulatorConfig config;
    private final AdbPacketEncoder encoder;
    private final AdbPacketDecoder decoder;
    private final RecordingLog<String> commandLog;
    private final RecordingLog<SyncCommand> syncCommandLog;
    private final EmulatorObservabilitySink observabilitySink;

    private ConnectionState state = ConnectionState.INIT;
    private AdbHeader pendingHeader;
    private SyncSession syncSession;

    public AdbConnection(String connectionId,
                         StreamConnection connection,
                         EmulatorConfig config,
                         AdbPacketEncoder encoder,
                         AdbPacketDecoder decoder,
                         RecordingLog<String> commandLog,
                         RecordingLog<SyncCommand> syncCommandLog,
                         EmulatorObservabilitySink observabilitySink)
    {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.commandLog = Objects.requireNonNull(commandLog, "commandLog");
        this.syncCommandLog = Objects.requireNonNull(syncCommandLog, "syncCommandLog");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Send the connect greeting. Called once, right after the connection is
     * accepted; the greeting does not wait for the peer's own CNXN.
     */
    public void sendGreeting()
    {
        if (state != ConnectionState.INIT) {
            return;
        }
        send(new AdbPacket(
                AdbCommand.CNXN,
                config.protocolVersion(),
                config.maxPayload(),
                config.banner().getBytes(StandardCharsets.UTF_8)));
        transition(ConnectionState.HANDSHAKE_SENT);
    }

    public ConnectionState state()
    {
        return state;
    }

    public String connectionId()
    {
        return connectionId;
    }

    // -------------------------------------------------------------------------
    // StreamConnectionListener
    // -------------------------------------------------------------------------

    @Override
    public int bytesRequired()
    {
        return switch (state) {
            case INIT -> AdbWireFormat.HEADER_LENGTH;
            case HANDSHAKE_SENT -> (pendingHeader == null)
                    ? AdbWireFormat.HEADER_LENGTH
                    : pendingHeader.dataLength();
            case IN_SYNC -> syncSession.bytesRequired();
            case CLOSED -> 0;
        };
    }

    @Override
    public void onBytes(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");

        switch (state) {
            case INIT -> {
                sendGreeting();
                onHeader(chunk);
            }
            case HANDSHAKE_SENT -> {
                if (pendingHeader == null) {
                    onHeader(chunk);
                } else {
                    AdbHeader header = pendingHeader;
                    pendingHeader = null;
                    dispatch(header, chunk);
                }
            }
            case IN_SYNC -> {
                syncSession.onBytes(chunk);
                if (syncSession.isFinished()) {
                    syncSession = null;
                    transition(ConnectionState.HANDSHAKE_SENT);
                }
            }
            case CLOSED -> {
                // Late bytes after a protocol-initiated close are dropped.
            }
        }
    }

    @Override
    public void onClosed()
    {
        syncSession = null;
        pendingHeader = null;
        transition(ConnectionState.CLOSED);
    }

    @Override
    public boolean isOpen()
    {
        return state != ConnectionState.CLOSED;
    }

    // -------------------------------------------------------------------------
    // Connection-layer packets
    // -------------------------------------------------------------------------

    private void onHeader(byte[] bytes)
    {
        Optional<AdbHeader> decoded = decoder.decode(bytes);
        if (decoded.isEmpty()) {
            malformed("undecodable header of " + bytes.length + " bytes");
            return;
        }

        AdbHeader header = decoded.get();
        if (header.dataLengthUnsigned() > config.maxInboundPayload()) {
            malformed("data length " + header.dataLengthUnsigned() + " exceeds " + config.maxInboundPayload());
            return;
        }

        if (header.dataLength() == 0) {
            dispatch(header, new byte[0]);
        } else {
            pendingHeader = header;
        }
    }

    private void dispatch(AdbHeader header, byte[] payload)
    {
        if (header.command() == AdbCommand.OPEN.code()) {
            onOpen(header, payload);
            return;
        }

        observabilitySink.onProtocolEvent(new ProtocolObservabilityEvent.PacketIgnored(
                Instant.now(), connectionId, WireTags.toTag(header.command())));
    }

    private void onOpen(AdbHeader header, byte[] payload)
    {
        String destination = decodeDestination(payload);

        // Record first: the OKAY below is the caller's synchronization point.
        commandLog.append(destination);
        observabilitySink.onProtocolEvent(new ProtocolObservabilityEvent.CommandRecorded(
                Instant.now(), connectionId, destination));

        send(AdbPacket.of(AdbCommand.OKAY, header.arg1(), header.arg0()));

        if (SYNC_SERVICE.equals(destination)) {
            syncSession = new SyncSession(connectionId, connection, syncCommandLog, config, observabilitySink);
            transition(ConnectionState.IN_SYNC);
        }
    }

    /**
     * OPEN destinations are usually NUL-terminated; trailing NULs are not part
     * of the destination.
     */
    static String decodeDestination(byte[] payload)
    {
        int end = payload.length;
        while (end > 0 && payload[end - 1] == 0) {
            end--;
        }
        return new String(payload, 0, end, StandardCharsets.UTF_8);
    }

    private void send(AdbPacket packet)
    {
        connection.write(encoder.encode(packet));
    }

    private void malformed(String reason)
    {
        observabilitySink.onProtocolEvent(new ProtocolObservabilityEvent.MalformedInput(
                Instant.now(), connectionId, reason));
        pendingHeader = null;
        transition(ConnectionState.CLOSED);
        connection.close();
    }

    private void transition(ConnectionState next)
    {
        ConnectionState previous = state;
        if (previous == next || previous == ConnectionState.CLOSED) {
            return;
        }
        state = next;
        observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(
                Instant.now(), connectionId, previous, next));
    }
}
