package com.mycelium.resilience.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * Storage collaborators tend to fail in bursts (a dead connection rejects every
 * mirrored mutation); this keeps one line per interval and counts the rest.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final Level level;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, Level.ERROR, minIntervalMillis);
    }

    public ErrorRateLimiter(Logger logger, Level level, long minIntervalMillis) {
        this.logger = logger;
        this.level = level;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs the message unless another one was logged within the interval.
     *
     * @return true if the message was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == 0 || now - last > minIntervalNanos) {
            // Check-and-set so only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long skipped = suppressed.getAndSet(0);
                if (skipped > 0)
                    logger.log(level, "{} (Throttled, {} suppressed)", message, skipped, t);
                else
                    logger.log(level, "{} (Throttled)", message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
