package com.questrail.adbemu.protocol.adb.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * WireTags
 * -----------------------------------------------------------------------------
 * Conversion between four-character ASCII wire tags (e.g. {@code "CNXN"},
 * {@code "SEND"}) and the 32-bit integers that carry them on the wire.
 *
 * <p>Both the connection layer and the sync sub-protocol transmit these tags
 * as the raw ASCII bytes, which every peer reads back as a little-endian
 * integer. The first character therefore occupies the least significant
 * byte:</p>
 *
 * <pre>
 *   "CNXN" = 'C' | 'N' &lt;&lt; 8 | 'X' &lt;&lt; 16 | 'N' &lt;&lt; 24 = 0x4E584E43
 * </pre>
 */
public final class WireTags
{
    /** Every tag is exactly four ASCII characters. */
    public static final int TAG_LENGTH = 4;

    private WireTags() {}

    /**
     * Returns the little-endian integer code of a four-character ASCII tag.
     *
     * @throws IllegalArgumentException if the tag is not four ASCII characters
     */
    public static int toCode(String tag)
    {
        Objects.requireNonNull(tag, "tag");
        if (tag.length() != TAG_LENGTH) {
            throw new IllegalArgumentException("Wire tag must be 4 characters: '" + tag + "'");
        }

        int code = 0;
        for (int i = 0; i < TAG_LENGTH; i++) {
            final char c = tag.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("Wire tag must be ASCII: '" + tag + "'");
            }
            code |= (c & 0xFF) << (8 * i);
        }
        return code;
    }

    /**
     * Returns the four-character rendering of an integer code.
     *
     * <p>Non-printable bytes are rendered as {@code '?'} so arbitrary inbound
     * codes can be logged safely.</p>
     */
    public static String toTag(int code)
    {
        byte[] chars = new byte[TAG_LENGTH];
        for (int i = 0; i < TAG_LENGTH; i++) {
            int b = (code >>> (8 * i)) & 0xFF;
            chars[i] = (byte) ((b >= 0x20 && b < 0x7F) ? b : '?');
        }
        return new String(chars, StandardCharsets.US_ASCII);
    }
}
