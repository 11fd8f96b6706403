package com.pricestream.subscription;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Closes connections that stopped sending heartbeats. Runs once per heartbeat interval
 * and drops anything silent for {@code staleAfterMissedHeartbeats} intervals.
 *
 * <p>The transport's own close callback will also try to deregister; that second call is
 * a no-op.
 */
@Component
public class StaleConnectionSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleConnectionSweeper.class);

    private final SubscriptionRegistry registry;
    private final ConnectionConfig config;

    public StaleConnectionSweeper(SubscriptionRegistry registry, ConnectionConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Scheduled(
            fixedRateString = "${pricestream.websocket.heartbeat-interval-ms:30000}",
            initialDelayString = "${pricestream.websocket.heartbeat-interval-ms:30000}")
    public void sweep() {
        int closed = closeStaleConnections();
        if (closed > 0) {
            log.info("Heartbeat sweep closed {} stale connections, {} remain", closed, registry.connectionCount());
        }
    }

    public int closeStaleConnections() {
        List<ClientConnection> stale = registry.staleConnections(config.getStaleAfterMs());
        for (ClientConnection connection : stale) {
            log.debug("Terminating stale connection {} (silent for more than {}ms)", connection.getId(), config.getStaleAfterMs());
            registry.deregister(connection.getId());
            connection.close("Connection timeout");
        }
        return stale.size();
    }
}
