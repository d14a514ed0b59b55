package com.taskboard;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing millisecond timestamps, so rows created in the same millisecond
 * still order by creation.
 */
public final class Timestamps {

    private static final AtomicLong last = new AtomicLong();

    private Timestamps() {
    }

    public static long next() {
        long now = System.currentTimeMillis();
        return last.updateAndGet(previous -> Math.max(now, previous + 1));
    }
}
