package com.pricestream.unit.subscription;

import static org.assertj.core.api.Assertions.assertThat;

import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.subscription.ConnectionConfig;
import com.pricestream.subscription.StaleConnectionSweeper;
import com.pricestream.subscription.SubscriptionRegistry;
import com.pricestream.support.MutableClock;
import com.pricestream.support.RecordingTransport;
import com.pricestream.support.StubPriceSource;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StaleConnectionSweeperTest {

    private MutableClock clock;
    private SubscriptionRegistry registry;
    private StaleConnectionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(0);
        ConnectionConfig config = new ConnectionConfig();
        config.setHeartbeatIntervalMs(30_000);
        config.setStaleAfterMissedHeartbeats(3);
        registry = new SubscriptionRegistry(config, new StubPriceSource(), clock);
        sweeper = new StaleConnectionSweeper(registry, config);
    }

    @Test
    @DisplayName("closes connections silent for three heartbeat intervals and keeps the rest")
    void closesOnlyStaleConnections() {
        RecordingTransport silent = new RecordingTransport("silent");
        RecordingTransport chatty = new RecordingTransport("chatty");
        registry.register(silent, CallerIdentity.anonymous("a"));
        registry.register(chatty, CallerIdentity.anonymous("b"));
        registry.subscribe("silent", List.of("BTC"));

        clock.advanceMillis(60_000);
        registry.touch("chatty");
        clock.advanceMillis(30_001);

        int closed = sweeper.closeStaleConnections();

        assertThat(closed).isEqualTo(1);
        assertThat(silent.isOpen()).isFalse();
        assertThat(silent.closeReason()).isEqualTo("Connection timeout");
        assertThat(chatty.isOpen()).isTrue();
        assertThat(registry.connectionIds()).containsExactly("chatty");
        assertThat(registry.subscribedSymbols()).isEmpty();
    }

    @Test
    @DisplayName("a connection exactly at the threshold is kept")
    void thresholdIsExclusive() {
        registry.register(new RecordingTransport("c1"), CallerIdentity.anonymous("a"));
        clock.advanceMillis(90_000);

        assertThat(sweeper.closeStaleConnections()).isZero();
        assertThat(registry.connectionCount()).isEqualTo(1);
    }
}
