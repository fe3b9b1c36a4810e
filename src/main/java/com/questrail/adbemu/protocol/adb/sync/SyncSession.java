package com.questrail.adbemu.protocol.adb.sync;

import com.questrail.adbemu.api.RecordingLog;
import com.questrail.adbemu.protocol.adb.config.EmulatorConfig;
import com.questrail.adbemu.protocol.adb.model.SyncCommand;
import com.questrail.adbemu.protocol.adb.model.SyncId;
import com.questrail.adbemu.protocol.adb.model.WireTags;
import com.questrail.adbemu.protocol.adb.observability.EmulatorObservabilitySink;
import com.questrail.adbemu.protocol.adb.observability.ProtocolObservabilityEvent;
import com.questrail.adbemu.protocol.adb.transport.StreamConnection;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SyncSession
 * =============================================================================
 * Handler for the file-transfer sub-protocol of one open {@code sync:} stream.
 *
 * <h2>Request loop</h2>
 * <pre>
 *   REQUEST_HEADER ──(id, pathLength)──→ REQUEST_PATH ──path──→ record + dispatch
 *        ↑                                                          │
 *        ├──────── RECV: DATA(content) + DONE ←─────────────────────┤
 *        ├──────── STAT: stat(0, 0, 0)        ←─────────────────────┤
 *        ├──────── LIST: DONE entry           ←─────────────────────┤
 *        │                                                          │
 *        │         SEND → DATA_HEADER ⇄ DATA_BODY (discarded)       │
 *        └──────── DONE: OKAY ←─┘                                   │
 *                                                                   │
 *   FINISHED ←──── QUIT, unsupported request, malformed request ────┘
 * </pre>
 *
 * <h2>Recording</h2>
 * Every complete request is appended to the sync command log before any reply
 * is written, so a caller that saw the reply also sees the entry. Transferred
 * file content is never kept; only the request and its metadata are observable.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Owned by one {@code AdbConnection} and driven from the
 * transport's event-loop thread, one chunk at a time. The session never blocks:
 * it states the size of the next chunk it needs through {@link #bytesRequired()}.
 */
public final class SyncSession
{
    /** Largest chunk in which discarded DATA content is consumed. */
    static final int DISCARD_CHUNK = 64 * 1024;

    enum Stage {
        REQUEST_HEADER,
        REQUEST_PATH,
        DATA_HEADER,
        DATA_BODY,
        FINISHED
    }

    private final String connectionId;
    private final StreamConnection connection;
    private final RecordingLog<SyncCommand> syncCommandLog;
    private final EmulatorConfig config;
    private final EmulatorObservabilitySink observabilitySink;
    private final byte[] pullContent;

    private Stage stage = Stage.REQUEST_HEADER;
    private SyncFrameHeader pendingRequest;
    private long remainingData;

    public SyncSession(String connectionId,
                       StreamConnection connection,
                       RecordingLog<SyncCommand> syncCommandLog,
                       EmulatorConfig config,
                       EmulatorObservabilitySink observabilitySink)
    {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.syncCommandLog = Objects.requireNonNull(syncCommandLog, "syncCommandLog");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.pullContent = config.pullContent().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Size of the next chunk this session consumes; {@code 0} once finished.
     */
    public int bytesRequired()
    {
        return switch (stage) {
            case REQUEST_HEADER, DATA_HEADER -> SyncFrames.HEADER_LENGTH;
            case REQUEST_PATH -> pendingRequest.length();
            case DATA_BODY -> (int) Math.min(remainingData, DISCARD_CHUNK);
            case FINISHED -> 0;
        };
    }

    /**
     * Consume exactly {@link #bytesRequired()} bytes.
     */
    public void onBytes(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.length != bytesRequired()) {
            throw new IllegalArgumentException(
                    "Expected " + bytesRequired() + " bytes in stage " + stage + ", got " + chunk.length);
        }

        switch (stage) {
            case REQUEST_HEADER -> onRequestHeader(SyncFrames.decodeHeader(chunk));
            case REQUEST_PATH -> onRequest(pendingRequest.id(), new String(chunk, StandardCharsets.UTF_8));
            case DATA_HEADER -> onDataHeader(SyncFrames.decodeHeader(chunk));
            case DATA_BODY -> onDataBody(chunk.length);
            case FINISHED -> throw new IllegalStateException("Sync session already finished");
        }
    }

    /**
     * True once the peer sent {@code QUIT} or the session was abandoned.
     */
    public boolean isFinished()
    {
        return stage == Stage.FINISHED;
    }

    Stage stage()
    {
        return stage;
    }

    // -------------------------------------------------------------------------
    // Request loop
    // -------------------------------------------------------------------------

    private void onRequestHeader(SyncFrameHeader header)
    {
        if (header.lengthUnsigned() > config.maxSyncPathLength()) {
            observabilitySink.onProtocolEvent(new ProtocolObservabilityEvent.MalformedInput(
                    Instant.now(), connectionId,
                    "sync path length " + header.lengthUnsigned() + " exceeds " + config.maxSyncPathLength()));
            fail("path too long");
            return;
        }

        if (header.length() == 0) {
            onRequest(header.id(), "");
            return;
        }

        pendingRequest = header;
        stage = Stage.REQUEST_PATH;
    }

    private void onRequest(int operationCode, String path)
    {
        pendingRequest = null;

        SyncCommand command = new SyncCommand(operationCode, path);
        syncCommandLog.append(command);
        observabilitySink.onProtocolEvent(new ProtocolObservabilityEvent.SyncRequestRecorded(
                Instant.now(), connectionId, command));

        Optional<SyncId> operation = command.operation();
        if (operation.isEmpty()) {
            fail("unsupported sync request: " + WireTags.toTag(operationCode));
            return;
        }

        switch (operation.get()) {
            case SEND -> stage = Stage.DATA_HEADER;
            case RECV -> {
                connection.write(SyncFrames.data(pullContent));
                connection.write(SyncFrames.header(SyncId.DONE, 0));
                stage = Stage.REQUEST_HEADER;
            }
            case STAT -> {
                connection.write(SyncFrames.stat(0, 0, 0));
                stage = Stage.REQUEST_HEADER;
            }
            case LIST -> {
                connection.write(SyncFrames.listDone());
                stage = Stage.REQUEST_HEADER;
            }
            case QUIT -> stage = Stage.FINISHED;
            default -> fail("unsupported sync request: " + operation.get().tag());
        }
    }

    // -------------------------------------------------------------------------
    // SEND content
    // -------------------------------------------------------------------------

    private void onDataHeader(SyncFrameHeader header)
    {
        if (header.id() == SyncId.DONE.code()) {
            connection.write(SyncFrames.header(SyncId.OKAY, 0));
            stage = Stage.REQUEST_HEADER;
            return;
        }

        // Anything other than DONE is content of the given length.
        remainingData = header.lengthUnsigned();
        stage = (remainingData == 0) ? Stage.DATA_HEADER : Stage.DATA_BODY;
    }

    private void onDataBody(int consumed)
    {
        remainingData -= consumed;
        if (remainingData == 0) {
            stage = Stage.DATA_HEADER;
        }
    }

    private void fail(String message)
    {
        connection.write(SyncFrames.fail(message));
        stage = Stage.FINISHED;
    }
}
