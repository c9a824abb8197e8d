package com.toycon.graph.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs at ERROR at most once per interval; anything in between is counted and
 * reported with the next message that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // So the very first error is always logged
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /**
     * @return true if the message was logged, false if it was suppressed.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} ({} similar errors suppressed)", message, dropped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
