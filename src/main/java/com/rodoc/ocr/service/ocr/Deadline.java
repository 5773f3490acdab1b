package com.rodoc.ocr.service.ocr;

import java.time.Duration;

/**
 * Time budget of one processing call, shared by every recognition invocation it makes.
 */
public final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration budget) {
        if (budget == null || budget.isNegative()) {
            throw new IllegalArgumentException("Time budget must be a non-negative duration");
        }
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public boolean exhausted() {
        return deadlineNanos - System.nanoTime() <= 0L;
    }
}
