package com.formulize.compute.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * A user function that throws on every slider drag would otherwise log once
 * per recompute.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    // Long.MIN_VALUE so the first error is always logged
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless another error was logged within the interval.
     *
     * @return true if the message was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last != Long.MIN_VALUE && now - last <= minIntervalNanos) {
            suppressed.incrementAndGet();
            return false;
        }
        // Only one thread logs per interval
        if (!lastLogTime.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long skipped = suppressed.getAndSet(0);
        if (skipped > 0)
            logger.error("{} ({} similar errors suppressed)", message, skipped, t);
        else
            logger.error(message, t);
        return true;
    }

    /** Errors dropped since the last written one. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
