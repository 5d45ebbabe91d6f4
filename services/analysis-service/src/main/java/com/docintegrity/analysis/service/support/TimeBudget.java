package com.docintegrity.analysis.service.support;

import java.time.Duration;

public final class TimeBudget {

    private final Duration total;
    private final long deadlineNanos;

    private TimeBudget(Duration total) {
        this.total = total;
        this.deadlineNanos = System.nanoTime() + total.toNanos();
    }

    public static TimeBudget start(Duration total) {
        return new TimeBudget(total);
    }

    public Duration total() {
        return total;
    }

    public Duration remaining() {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public boolean exhausted() {
        return remaining().isZero();
    }
}
