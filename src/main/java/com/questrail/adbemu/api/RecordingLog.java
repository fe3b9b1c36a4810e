package com.questrail.adbemu.api;

import java.util.List;

/**
 * RecordingLog
 * -----------------------------------------------------------------------------
 * Ordered, append-only record of what the emulator observed, shared between the
 * emulator's event loop (producer) and the caller (consumer).
 *
 * <h2>Threading contract</h2>
 * <ul>
 *   <li>All methods are safe to call concurrently from any thread.</li>
 *   <li>{@link #snapshot()} returns an immutable copy in append order; later
 *       appends never show up in a previously returned snapshot.</li>
 *   <li>An entry is appended before the emulator writes the reply to the
 *       request that produced it. A caller that has seen the reply (for example
 *       because the client process exited) therefore sees the entry.</li>
 * </ul>
 *
 * @param <E> entry type
 */
public interface RecordingLog<E>
{
    /**
     * Append an entry at the end of the log.
     */
    void append(E entry);

    /**
     * Returns an immutable copy of the current entries, oldest first.
     */
    List<E> snapshot();

    /**
     * Removes every entry. A {@link #snapshot()} taken immediately afterwards
     * is empty unless the emulator appended in between.
     */
    void clear();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
