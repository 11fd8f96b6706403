package com.pricestream.unit.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.pricestream.ratelimit.InMemoryRateLimitStore;
import com.pricestream.ratelimit.RateLimitStore.WindowState;
import com.pricestream.support.MutableClock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryRateLimitStoreTest {

    private MutableClock clock;
    private InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(0);
        store = new InMemoryRateLimitStore(clock);
    }

    @Test
    @DisplayName("reports count and oldest admitted timestamp")
    void reportsWindowState() {
        store.acquire("k", 3, 1_000, 100);
        store.acquire("k", 3, 1_000, 200);
        WindowState state = store.acquire("k", 3, 1_000, 300);

        assertThat(state.admitted()).isTrue();
        assertThat(state.count()).isEqualTo(3);
        assertThat(state.oldestTimestamp()).isEqualTo(100);

        WindowState rejected = store.acquire("k", 3, 1_000, 400);
        assertThat(rejected.admitted()).isFalse();
        assertThat(rejected.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("an entry exactly one window old has expired")
    void boundaryExpires() {
        store.acquire("k", 1, 1_000, 0);

        assertThat(store.acquire("k", 1, 1_000, 999).admitted()).isFalse();
        assertThat(store.acquire("k", 1, 1_000, 1_000).admitted()).isTrue();
    }

    @Test
    @DisplayName("purge drops only keys whose windows are empty")
    void purgeDropsIdleKeys() {
        store.acquire("old", 5, 1_000, 0);
        store.acquire("recent", 5, 1_000, 800);

        int removed = store.purgeExpired(1_500);

        assertThat(removed).isEqualTo(1);
        assertThat(store.keyCount()).isEqualTo(1);
        assertThat(store.acquire("recent", 5, 1_000, 1_500).count()).isEqualTo(2);
    }

    @Test
    @DisplayName("scheduled purge uses the store clock")
    void scheduledPurge() {
        store.acquire("k", 5, 1_000, 0);
        clock.advanceMillis(5_000);

        store.purgeExpired();

        assertThat(store.keyCount()).isZero();
    }

    @Test
    @DisplayName("concurrent callers on one key never exceed the limit")
    void concurrentAcquireRespectsLimit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 500; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (store.acquire("hot", 100, 60_000, 10).admitted()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(100);
    }
}
