package com.questrail.adbemu.protocol.adb.sync;

import com.questrail.adbemu.protocol.adb.model.SyncId;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * SyncFrames
 * -----------------------------------------------------------------------------
 * Wire layouts of the sync sub-protocol carried inside an open {@code sync:}
 * stream. All words are little-endian.
 *
 * <pre>
 *   request / data header : id (u32) | length (u32)              8 bytes
 *   STAT reply (v1)       : "STAT" | mode | size | mtime         16 bytes
 *   directory entry       : "DENT" | mode | size | mtime | namelen  20 bytes + name
 * </pre>
 *
 * <p>A directory listing is terminated by an entry whose id is {@code DONE}
 * and whose other fields are zero.</p>
 */
public final class SyncFrames
{
    public static final int HEADER_LENGTH = 8;
    public static final int STAT_LENGTH = 16;
    public static final int DENT_LENGTH = 20;

    private SyncFrames() {}

    /**
     * Encode an 8-byte header.
     */
    public static byte[] header(SyncId id, int length)
    {
        return buffer(HEADER_LENGTH)
                .putInt(id.code())
                .putInt(length)
                .array();
    }

    /**
     * Encode a request header followed by its UTF-8 path.
     */
    public static byte[] request(SyncId id, String path)
    {
        Objects.requireNonNull(path, "path");
        byte[] bytes = path.getBytes(StandardCharsets.UTF_8);
        return buffer(HEADER_LENGTH + bytes.length)
                .putInt(id.code())
                .putInt(bytes.length)
                .put(bytes)
                .array();
    }

    /**
     * Encode a {@code DATA} header followed by the content bytes.
     */
    public static byte[] data(byte[] content)
    {
        Objects.requireNonNull(content, "content");
        return buffer(HEADER_LENGTH + content.length)
                .putInt(SyncId.DATA.code())
                .putInt(content.length)
                .put(content)
                .array();
    }

    /**
     * Encode a {@code FAIL} reply carrying a UTF-8 message.
     */
    public static byte[] fail(String message)
    {
        Objects.requireNonNull(message, "message");
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        return buffer(HEADER_LENGTH + bytes.length)
                .putInt(SyncId.FAIL.code())
                .putInt(bytes.length)
                .put(bytes)
                .array();
    }

    /**
     * Encode a v1 {@code STAT} reply. All-zero fields mean the path does not exist.
     */
    public static byte[] stat(int mode, int size, int mtime)
    {
        return buffer(STAT_LENGTH)
                .putInt(SyncId.STAT.code())
                .putInt(mode)
                .putInt(size)
                .putInt(mtime)
                .array();
    }

    /**
     * Encode the {@code DONE} entry that terminates a directory listing.
     */
    public static byte[] listDone()
    {
        return buffer(DENT_LENGTH)
                .putInt(SyncId.DONE.code())
                .putInt(0)
                .putInt(0)
                .putInt(0)
                .putInt(0)
                .array();
    }

    /**
     * Decode an 8-byte header.
     *
     * @throws IllegalArgumentException if {@code bytes} is not exactly 8 bytes
     */
    public static SyncFrameHeader decodeHeader(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != HEADER_LENGTH) {
            throw new IllegalArgumentException("Sync header must be 8 bytes, got " + bytes.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        return new SyncFrameHeader(buf.getInt(), buf.getInt());
    }

    private static ByteBuffer buffer(int size)
    {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
