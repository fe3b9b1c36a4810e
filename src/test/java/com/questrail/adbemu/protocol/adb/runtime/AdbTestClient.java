package com.questrail.adbemu.protocol.adb.runtime;

import com.questrail.adbemu.protocol.adb.codec.impl.DefaultAdbPacketDecoder;
import com.questrail.adbemu.protocol.adb.codec.impl.DefaultAdbPacketEncoder;
import com.questrail.adbemu.protocol.adb.internal.frame.AdbHeader;
import com.questrail.adbemu.protocol.adb.model.AdbCommand;
import com.questrail.adbemu.protocol.adb.model.AdbPacket;
import com.questrail.adbemu.protocol.adb.model.SyncId;
import com.questrail.adbemu.protocol.adb.sync.SyncFrameHeader;
import com.questrail.adbemu.protocol.adb.sync.SyncFrames;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * AdbTestClient
 * -----------------------------------------------------------------------------
 * Minimal blocking client used by socket-level tests. It speaks just enough of
 * the protocol to open services and run sync requests, and fails loudly on any
 * unexpected reply.
 */
final class AdbTestClient implements AutoCloseable
{
    /** A received connection-layer packet. */
    record Received(AdbHeader header, byte[] payload) {
        String payloadText() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private static final int READ_TIMEOUT_MILLIS = 5000;

    private final DefaultAdbPacketEncoder encoder = new DefaultAdbPacketEncoder();
    private final DefaultAdbPacketDecoder decoder = new DefaultAdbPacketDecoder();
    private final Socket socket;
    private final DataInputStream in;
    private final OutputStream out;
    private int nextLocalId = 1;

    private AdbTestClient(Socket socket) throws IOException
    {
        this.socket = socket;
        this.in = new DataInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    static AdbTestClient connect(InetSocketAddress address) throws IOException
    {
        Socket socket = new Socket();
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        socket.connect(address, READ_TIMEOUT_MILLIS);
        return new AdbTestClient(socket);
    }

    Received readPacket() throws IOException
    {
        byte[] header = new byte[24];
        in.readFully(header);
        AdbHeader decoded = decoder.decode(header).orElseThrow();
        byte[] payload = new byte[decoded.dataLength()];
        in.readFully(payload);
        return new Received(decoded, payload);
    }

    /** Read and check the connect greeting. */
    Received readGreeting() throws IOException
    {
        Received greeting = readPacket();
        expect(AdbCommand.CNXN, greeting.header());
        return greeting;
    }

    void sendPacket(AdbPacket packet) throws IOException
    {
        write(encoder.encode(packet));
    }

    void sendConnect() throws IOException
    {
        sendPacket(new AdbPacket(AdbCommand.CNXN, 0x01000001, 256 * 1024,
                "host::\0".getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Open a service and wait for its OKAY.
     *
     * @return the OKAY header
     */
    AdbHeader open(String destination) throws IOException
    {
        int localId = nextLocalId++;
        sendPacket(new AdbPacket(AdbCommand.OPEN, localId, 0,
                (destination + "\0").getBytes(StandardCharsets.UTF_8)));
        AdbHeader okay = readPacket().header();
        expect(AdbCommand.OKAY, okay);
        if (okay.arg1() != localId) {
            throw new IOException("OKAY for wrong stream: " + okay);
        }
        return okay;
    }

    /** Push {@code content} with SEND/DATA/DONE and wait for the sync OKAY. */
    void push(String remotePath, int mode, byte[] content) throws IOException
    {
        write(SyncFrames.request(SyncId.SEND, remotePath + "," + mode));
        write(SyncFrames.data(content));
        write(SyncFrames.header(SyncId.DONE, 0));
        SyncFrameHeader reply = readSyncHeader();
        if (reply.id() != SyncId.OKAY.code()) {
            throw new IOException("Expected sync OKAY, got " + reply);
        }
    }

    /** Pull with RECV and collect DATA frames until DONE. */
    byte[] pull(String remotePath) throws IOException
    {
        write(SyncFrames.request(SyncId.RECV, remotePath));
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        while (true) {
            SyncFrameHeader frame = readSyncHeader();
            if (frame.id() == SyncId.DONE.code()) {
                return content.toByteArray();
            }
            if (frame.id() != SyncId.DATA.code()) {
                throw new IOException("Unexpected frame during pull: " + frame);
            }
            byte[] chunk = new byte[frame.length()];
            in.readFully(chunk);
            content.writeBytes(chunk);
        }
    }

    void quit() throws IOException
    {
        write(SyncFrames.header(SyncId.QUIT, 0));
    }

    SyncFrameHeader readSyncHeader() throws IOException
    {
        byte[] header = new byte[SyncFrames.HEADER_LENGTH];
        in.readFully(header);
        return SyncFrames.decodeHeader(header);
    }

    byte[] readBytes(int length) throws IOException
    {
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    void write(byte[] bytes) throws IOException
    {
        out.write(bytes);
        out.flush();
    }

    /** True once the emulator has closed its side. */
    boolean isClosedByPeer() throws IOException
    {
        return in.read() == -1;
    }

    @Override
    public void close() throws IOException
    {
        socket.close();
    }

    private static void expect(AdbCommand command, AdbHeader header) throws IOException
    {
        if (header.command() != command.code()) {
            throw new IOException("Expected " + command + ", got " + header);
        }
    }
}
