package com.questrail.adbemu.protocol.adb.sync;

import com.questrail.adbemu.core.SynchronizedRecordingLog;
import com.questrail.adbemu.protocol.adb.config.EmulatorConfig;
import com.questrail.adbemu.protocol.adb.model.SyncCommand;
import com.questrail.adbemu.protocol.adb.model.SyncId;
import com.questrail.adbemu.protocol.adb.model.WireTags;
import com.questrail.adbemu.protocol.adb.observability.NullObservabilitySink;
import com.questrail.adbemu.protocol.adb.observability.ProtocolObservabilityEvent;
import com.questrail.adbemu.protocol.adb.observability.RecordingObservabilitySink;
import com.questrail.adbemu.protocol.adb.transport.FakeStreamConnection;
import com.questrail.adbemu.protocol.adb.transport.StreamConnection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncSessionTest
 * -----------------------------------------------------------------------------
 * Drives a {@link SyncSession} with raw sync frames and checks recorded
 * requests and the exact reply bytes.
 */
final class SyncSessionTest
{
    private FakeStreamConnection connection;
    private SynchronizedRecordingLog<SyncCommand> log;
    private RecordingObservabilitySink sink;
    private SyncSession session;

    @BeforeEach
    void setUp()
    {
        connection = new FakeStreamConnection();
        log = new SynchronizedRecordingLog<>();
        sink = new RecordingObservabilitySink();
        session = newSession(EmulatorConfig.defaults());
    }

    private SyncSession newSession(EmulatorConfig config)
    {
        return new SyncSession("c1", connection, log, config, sink);
    }

    @Test
    void pushRecordsSendAndAcknowledgesDone()
    {
        feed(concat(
                SyncFrames.request(SyncId.SEND, "/data/local/tmp/test,33188"),
                SyncFrames.data("abc".getBytes(StandardCharsets.UTF_8)),
                SyncFrames.header(SyncId.DONE, 1700000000)));

        assertEquals(List.of(SyncCommand.of(SyncId.SEND, "/data/local/tmp/test,33188")), log.snapshot());
        assertArrayEquals(SyncFrames.header(SyncId.OKAY, 0), connection.written());
        assertEquals(SyncSession.Stage.REQUEST_HEADER, session.stage());
        assertFalse(session.isFinished());
    }

    @Test
    void pushContentIsDiscardedAcrossManyChunks()
    {
        byte[] big = new byte[SyncSession.DISCARD_CHUNK * 2 + 17];
        feed(concat(
                SyncFrames.request(SyncId.SEND, "/sdcard/big,420"),
                SyncFrames.data(big),
                SyncFrames.data(new byte[0]),
                SyncFrames.data(new byte[] { 1 }),
                SyncFrames.header(SyncId.DONE, 0)));

        assertArrayEquals(SyncFrames.header(SyncId.OKAY, 0), connection.written());
        assertEquals(1, log.size());
    }

    @Test
    void pullRepliesWithContentThenDone()
    {
        feed(SyncFrames.request(SyncId.RECV, "/data/local/tmp/test"));

        assertEquals(List.of(SyncCommand.of(SyncId.RECV, "/data/local/tmp/test")), log.snapshot());
        assertArrayEquals(concat(
                SyncFrames.data("hello from fake adbd".getBytes(StandardCharsets.UTF_8)),
                SyncFrames.header(SyncId.DONE, 0)), connection.written());
    }

    @Test
    void pullContentIsConfigurable()
    {
        session = new SyncSession("c1", connection, log,
                EmulatorConfig.builder().withPullContent("").build(), NullObservabilitySink.INSTANCE);

        feed(SyncFrames.request(SyncId.RECV, "/x"));

        assertArrayEquals(concat(SyncFrames.data(new byte[0]), SyncFrames.header(SyncId.DONE, 0)),
                connection.written());
    }

    @Test
    void statAndListReportNothing()
    {
        feed(concat(
                SyncFrames.request(SyncId.STAT, "/sdcard"),
                SyncFrames.request(SyncId.LIST, "/sdcard")));

        assertArrayEquals(concat(SyncFrames.stat(0, 0, 0), SyncFrames.listDone()), connection.written());
        assertEquals(2, log.size());
    }

    @Test
    void quitEndsTheSessionWithoutReply()
    {
        feed(SyncFrames.header(SyncId.QUIT, 0));

        assertTrue(session.isFinished());
        assertEquals(0, session.bytesRequired());
        assertEquals(0, connection.written().length);
        assertEquals(List.of(SyncCommand.of(SyncId.QUIT, "")), log.snapshot());
    }

    @Test
    void requestsInOneSessionAreRecordedInOrder()
    {
        feed(concat(
                SyncFrames.request(SyncId.SEND, "/a,420"),
                SyncFrames.header(SyncId.DONE, 0),
                SyncFrames.request(SyncId.RECV, "/b"),
                SyncFrames.header(SyncId.QUIT, 0)));

        assertEquals(List.of(
                SyncCommand.of(SyncId.SEND, "/a,420"),
                SyncCommand.of(SyncId.RECV, "/b"),
                SyncCommand.of(SyncId.QUIT, "")), log.snapshot());
        assertTrue(session.isFinished());
    }

    @Test
    void unknownRequestIsRecordedThenFailed()
    {
        int odd = WireTags.toCode("ZZZZ");
        byte[] request = ByteBuffer.allocate(10).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(odd).putInt(2).put((byte) '/').put((byte) 'x').array();

        feed(request);

        assertEquals(List.of(new SyncCommand(odd, "/x")), log.snapshot());
        assertArrayEquals(SyncFrames.fail("unsupported sync request: ZZZZ"), connection.written());
        assertTrue(session.isFinished());
    }

    @Test
    void replyFramesAreNotAcceptedAsRequests()
    {
        feed(SyncFrames.header(SyncId.DATA, 0));

        assertArrayEquals(SyncFrames.fail("unsupported sync request: DATA"), connection.written());
        assertTrue(session.isFinished());
    }

    @Test
    void overlongPathFailsWithoutRecording()
    {
        session = newSession(EmulatorConfig.builder().withMaxSyncPathLength(4).build());

        feed(SyncFrames.header(SyncId.RECV, 5));

        assertTrue(log.isEmpty());
        assertArrayEquals(SyncFrames.fail("path too long"), connection.written());
        assertTrue(session.isFinished());
        assertTrue(sink.hasEventOfType(ProtocolObservabilityEvent.MalformedInput.class));
    }

    @Test
    void requestIsRecordedBeforeReplyIsWritten()
    {
        List<Integer> logSizesAtWrite = new ArrayList<>();
        session = new SyncSession("c1", new StreamConnection() {
            @Override
            public void write(byte[] bytes) {
                logSizesAtWrite.add(log.size());
            }

            @Override
            public void close() {
            }
        }, log, EmulatorConfig.defaults(), sink);

        feed(SyncFrames.request(SyncId.RECV, "/p"));

        assertEquals(List.of(1, 1), logSizesAtWrite);
    }

    @Test
    void wrongChunkSizeIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> session.onBytes(new byte[7]));
    }

    // ---------------------------------------------------------------------

    private void feed(byte[] bytes)
    {
        int offset = 0;
        while (!session.isFinished() && offset < bytes.length) {
            int required = session.bytesRequired();
            byte[] chunk = new byte[required];
            System.arraycopy(bytes, offset, chunk, 0, required);
            offset += required;
            session.onBytes(chunk);
        }
    }

    private static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.writeBytes(p);
        }
        return out.toByteArray();
    }
}
