package com.pricestream.ratelimit;

/**
 * Outcome of one rate-limit check.
 *
 * @param allowed whether the request was admitted (and recorded)
 * @param limit the limit that applied
 * @param remaining admissions left in the current window after this call
 * @param resetAtMillis epoch millis at which the oldest admitted entry leaves the window
 * @param windowMs length of the sliding window
 */
public record RateLimitResult(boolean allowed, int limit, int remaining, long resetAtMillis, long windowMs) {

    public long resetAtEpochSeconds() {
        return (resetAtMillis + 999) / 1000;
    }

    /** Whole seconds a rejected caller should wait, never less than one. */
    public long retryAfterSeconds(long nowMillis) {
        long waitMs = resetAtMillis - nowMillis;
        return Math.max(1, (waitMs + 999) / 1000);
    }
}
