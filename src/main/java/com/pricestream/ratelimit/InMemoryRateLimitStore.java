package com.pricestream.ratelimit;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Process-local sliding-window store. Each key owns a deque of admitted timestamps in
 * arrival order. All reads and writes of one key run inside {@link ConcurrentMap#compute},
 * which makes the expire-count-record sequence atomic per key.
 *
 * <p>Suitable for a single instance or for tests. Limits are not shared across instances.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimitStore.class);

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WindowState acquire(String key, int limit, long windowMs, long nowMs) {
        WindowState[] result = new WindowState[1];
        windows.compute(key, (k, existing) -> {
            Window window = existing != null ? existing : new Window();
            window.windowMs = windowMs;
            window.expire(nowMs);

            boolean admitted = window.timestamps.size() < limit;
            if (admitted) {
                window.timestamps.addLast(nowMs);
            }
            long oldest = window.timestamps.isEmpty() ? nowMs : window.timestamps.peekFirst();
            result[0] = new WindowState(admitted, window.timestamps.size(), oldest);
            return window;
        });
        return result[0];
    }

    /** Drops keys whose windows have fully expired so idle identifiers do not accumulate. */
    @Scheduled(fixedDelayString = "${pricestream.rate-limit.purge-interval-ms:60000}")
    public void purgeExpired() {
        int removed = purgeExpired(clock.millis());
        if (removed > 0) {
            log.debug("Purged {} idle rate-limit windows", removed);
        }
    }

    public int purgeExpired(long nowMs) {
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] dropped = new boolean[1];
            windows.computeIfPresent(key, (k, window) -> {
                window.expire(nowMs);
                dropped[0] = window.timestamps.isEmpty();
                return dropped[0] ? null : window;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        return removed;
    }

    public int keyCount() {
        return windows.size();
    }

    private static final class Window {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long windowMs;

        private void expire(long nowMs) {
            long cutoff = nowMs - windowMs;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
        }
    }
}
