package com.questrail.adbemu.protocol.adb.sync;

import com.questrail.adbemu.protocol.adb.model.SyncId;
import com.questrail.adbemu.protocol.adb.model.WireTags;

import java.util.Optional;

/**
 * Decoded 8-byte sync header: {@code (id, length)}.
 *
 * <p>For requests the length is the path length; for {@code DATA} it is the
 * number of content bytes that follow; for {@code DONE} the real protocol
 * carries the file mtime, which the emulator ignores.</p>
 */
public record SyncFrameHeader(int id, int length) {

    public Optional<SyncId> syncId() {
        return SyncId.fromCode(id);
    }

    public long lengthUnsigned() {
        return Integer.toUnsignedLong(length);
    }

    @Override
    public String toString() {
        return "SyncFrameHeader[" + WireTags.toTag(id) + ", length=" + Integer.toUnsignedString(length) + ']';
    }
}
