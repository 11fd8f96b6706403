package com.pricestream.subscription;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for client connections under the {@code pricestream.websocket} prefix.
 *
 * <p>A connection is considered stale once it has been silent for
 * {@code heartbeatIntervalMs * staleAfterMissedHeartbeats}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pricestream.websocket")
public class ConnectionConfig {

    private int maxConnections = 1000;
    private long heartbeatIntervalMs = 30000;
    private int staleAfterMissedHeartbeats = 3;
    private int maxMessageBytes = 16384;
    private int sendTimeLimitMs = 10000;
    private int sendBufferBytes = 512 * 1024;
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    public long getStaleAfterMs() {
        return heartbeatIntervalMs * staleAfterMissedHeartbeats;
    }
}
