package com.questrail.adbemu.protocol.adb.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One sync request as recorded by the emulator.
 *
 * <p>
 * The operation is kept as the raw wire code so that requests the emulator
 * does not understand are still recorded faithfully. The path is the request
 * argument exactly as received; for {@link SyncId#SEND} it carries the file
 * mode as {@code "<path>,<mode>"}.
 * </p>
 *
 * @param operationCode little-endian wire code of the request
 * @param path          UTF-8 decoded request argument
 */
public record SyncCommand(int operationCode, String path)
{
    public SyncCommand {
        Objects.requireNonNull(path, "path");
    }

    public static SyncCommand of(SyncId operation, String path)
    {
        return new SyncCommand(operation.code(), path);
    }

    /** The request type, if it is one the emulator knows. */
    public Optional<SyncId> operation()
    {
        return SyncId.fromCode(operationCode);
    }

    /**
     * The POSIX mode of a {@code SEND} request, parsed from the decimal suffix
     * after the last comma.
     */
    public OptionalInt sendMode()
    {
        if (operationCode != SyncId.SEND.code()) {
            return OptionalInt.empty();
        }
        int comma = path.lastIndexOf(',');
        if (comma < 0) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(path.substring(comma + 1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    @Override
    public String toString()
    {
        return "SyncCommand[" + WireTags.toTag(operationCode) + ", " + path + ']';
    }
}
