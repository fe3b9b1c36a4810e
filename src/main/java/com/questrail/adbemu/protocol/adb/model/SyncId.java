package com.questrail.adbemu.protocol.adb.model;

import java.util.Optional;

/**
 * Identifier of a sync sub-protocol request or response frame.
 *
 * <p>
 * Requests ({@link #STAT}, {@link #LIST}, {@link #SEND}, {@link #RECV},
 * {@link #QUIT}) open an 8-byte {@code (id, length)} header followed by a path.
 * Data frames ({@link #DATA}, {@link #DONE}) and replies ({@link #OKAY},
 * {@link #FAIL}, {@link #DENT}) reuse the same header shape.
 * </p>
 *
 * <p>Codes are derived from the tags with {@link WireTags#toCode(String)}.</p>
 */
public enum SyncId
{
    STAT("STAT"),
    LIST("LIST"),
    SEND("SEND"),
    RECV("RECV"),
    QUIT("QUIT"),
    DATA("DATA"),
    DONE("DONE"),
    OKAY("OKAY"),
    FAIL("FAIL"),
    DENT("DENT");

    private final String tag;
    private final int code;

    SyncId(String tag)
    {
        this.tag = tag;
        this.code = WireTags.toCode(tag);
    }

    public String tag()
    {
        return tag;
    }

    public int code()
    {
        return code;
    }

    public static Optional<SyncId> fromCode(int code)
    {
        for (SyncId id : values()) {
            if (id.code == code) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
