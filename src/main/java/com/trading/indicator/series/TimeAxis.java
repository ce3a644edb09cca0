package com.trading.indicator.series;

import java.util.Arrays;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The append-only, strictly increasing sequence of time points shared by every
 * column of a series family.
 *
 * <p>
 * Locking: one reader/writer lock guards the axis. Every {@code computeTo} holds
 * the read lock for its whole duration, {@link #append(long)} takes the write
 * lock. A computation therefore always sees a stable axis length, and an append
 * waits for in-flight computations to finish. The read lock is reentrant, so a
 * function may call into other functions while holding it. The write lock must
 * never be requested by a thread that holds the read lock.
 */
public final class TimeAxis {
    private static final int INITIAL_CAPACITY = 256;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long[] times = new long[INITIAL_CAPACITY];
    private volatile int size;

    /**
     * Appends a time point.
     *
     * @throws OutOfOrderTimestampException if {@code time <= lastTime()}.
     */
    public void append(long time) {
        Lock w = lock.writeLock();
        w.lock();
        try {
            appendUnlocked(time);
        } finally {
            w.unlock();
        }
    }

    /** Caller must hold the write lock. */
    void appendUnlocked(long time) {
        int n = size;
        if (n > 0 && time <= times[n - 1]) {
            throw new OutOfOrderTimestampException(times[n - 1], time);
        }
        if (n == times.length) {
            times = Arrays.copyOf(times, n * 2);
        }
        times[n] = time;
        size = n + 1;
    }

    /**
     * Binary search for an exact time point.
     *
     * @return The index of {@code time}, or -1 if it is not on the axis.
     */
    public int indexOf(long time) {
        int i = Arrays.binarySearch(times, 0, size, time);
        return i >= 0 ? i : -1;
    }

    /**
     * @return The index of the first time point {@code >= time}, or
     *         {@code size()} when every point is earlier.
     */
    public int ceilingIndexOf(long time) {
        int i = Arrays.binarySearch(times, 0, size, time);
        return i >= 0 ? i : -(i + 1);
    }

    /**
     * @return The index of the last time point {@code <= time}, or -1 when every
     *         point is later.
     */
    public int floorIndexOf(long time) {
        int i = Arrays.binarySearch(times, 0, size, time);
        return i >= 0 ? i : -(i + 1) - 1;
    }

    public long timeOf(int index) {
        if (index < 0 || index >= size)
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for axis size " + size);
        return times[index];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** @return The last time point, or {@code Long.MIN_VALUE} if the axis is empty. */
    public long lastTime() {
        int n = size;
        return n == 0 ? Long.MIN_VALUE : times[n - 1];
    }

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }
}
