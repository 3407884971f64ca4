package com.poolradar.common;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Sliding-window rate limiter: at most {@code maxRequests} admissions within any trailing {@code windowMs}.
 * Callers over the ceiling are delayed until the oldest admission leaves the window; nothing is rejected.
 */
public class RateLimiter {

    private final int maxRequests;
    private final long windowMs;
    private final LongSupplier clockMs;
    private final Deque<Long> admissions = new ArrayDeque<>();

    public RateLimiter(int maxRequests, long windowMs) {
        this(maxRequests, windowMs, System::currentTimeMillis);
    }

    RateLimiter(int maxRequests, long windowMs, LongSupplier clockMs) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.clockMs = clockMs;
    }

    /**
     * Per-second limiter, e.g. 10 for 10 requests per second.
     */
    public static RateLimiter perSecond(int maxRequests) {
        return new RateLimiter(maxRequests, 1000L);
    }

    /**
     * Blocks until a slot is available, then records the admission and returns.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitSlot() throws InterruptedException {
        while (true) {
            long waitMs;
            synchronized (this) {
                long now = clockMs.getAsLong();
                evictOutsideWindow(now);
                if (admissions.size() < maxRequests) {
                    admissions.addLast(now);
                    return;
                }
                waitMs = windowMs - (now - admissions.peekFirst());
            }
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
        }
    }

    /**
     * Non-blocking: returns true if a slot was taken, false if the caller would have to wait.
     */
    public synchronized boolean tryAcquire() {
        long now = clockMs.getAsLong();
        evictOutsideWindow(now);
        if (admissions.size() < maxRequests) {
            admissions.addLast(now);
            return true;
        }
        return false;
    }

    /**
     * Admissions currently inside the trailing window.
     */
    public synchronized int inWindow() {
        evictOutsideWindow(clockMs.getAsLong());
        return admissions.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public long getWindowMs() {
        return windowMs;
    }

    private void evictOutsideWindow(long now) {
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowMs) {
            admissions.pollFirst();
        }
    }
}
