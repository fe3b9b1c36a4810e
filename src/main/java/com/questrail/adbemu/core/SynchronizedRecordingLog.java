package com.questrail.adbemu.core;

import com.questrail.adbemu.api.RecordingLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SynchronizedRecordingLog
 * -----------------------------------------------------------------------------
 * {@link RecordingLog} backed by an {@link ArrayList} guarded by the instance
 * monitor.
 *
 * <p>Appends come from a single event-loop thread and snapshots from test
 * threads, so contention is negligible and a plain monitor is enough.</p>
 */
public final class SynchronizedRecordingLog<E> implements RecordingLog<E>
{
    private final List<E> entries = new ArrayList<>();

    @Override
    public synchronized void append(E entry)
    {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public synchronized List<E> snapshot()
    {
        return List.copyOf(entries);
    }

    @Override
    public synchronized void clear()
    {
        entries.clear();
    }

    @Override
    public synchronized int size()
    {
        return entries.size();
    }

    @Override
    public synchronized String toString()
    {
        return "SynchronizedRecordingLog" + entries;
    }
}
