package com.pricestream.ratelimit;

/**
 * Backing store for sliding-window request logs.
 *
 * <p>{@link #acquire} must be atomic per key: expire entries older than
 * {@code nowMs - windowMs}, count what is left, and record the attempt only when the
 * count is below {@code limit}. Implementations may throw any runtime exception when the
 * store is unreachable; the caller decides how to degrade.
 */
public interface RateLimitStore {

    WindowState acquire(String key, int limit, long windowMs, long nowMs);

    /**
     * State of one window after an acquire attempt.
     *
     * @param admitted whether the attempt was recorded
     * @param count entries in the window after the attempt
     * @param oldestTimestamp timestamp of the oldest entry still in the window, or the
     *     attempt time when the window is empty
     */
    record WindowState(boolean admitted, int count, long oldestTimestamp) {}
}
