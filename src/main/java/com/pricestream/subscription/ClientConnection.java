package com.pricestream.subscription;

import com.pricestream.domain.enums.SubscriptionTier;
import com.pricestream.domain.model.CallerIdentity;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A live client connection as tracked by the {@link SubscriptionRegistry}.
 *
 * <p>The subscribed-symbol set is guarded by the registry's lock and is only mutated
 * through package-private methods. Outbound messages go through {@link #deliver}, which is
 * synchronized so every message to this connection is written in call order.
 */
public class ClientConnection {

    private final ConnectionTransport transport;
    private final CallerIdentity identity;
    private final Instant connectedAt;
    private final Set<String> subscribedSymbols = new HashSet<>();
    private volatile long lastActivityMillis;

    ClientConnection(ConnectionTransport transport, CallerIdentity identity, long nowMillis) {
        this.transport = transport;
        this.identity = identity;
        this.connectedAt = Instant.ofEpochMilli(nowMillis);
        this.lastActivityMillis = nowMillis;
    }

    public String getId() {
        return transport.id();
    }

    public CallerIdentity getIdentity() {
        return identity;
    }

    public String getUserId() {
        return identity.userId();
    }

    public SubscriptionTier getTier() {
        return identity.tier();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public long getLastActivityMillis() {
        return lastActivityMillis;
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    public synchronized SendResult deliver(String payload) {
        if (!transport.isOpen()) {
            return SendResult.CLOSED;
        }
        return transport.send(payload);
    }

    public void close(String reason) {
        transport.close(reason);
    }

    void markActive(long nowMillis) {
        this.lastActivityMillis = nowMillis;
    }

    boolean addSymbol(String symbol) {
        return subscribedSymbols.add(symbol);
    }

    boolean removeSymbol(String symbol) {
        return subscribedSymbols.remove(symbol);
    }

    Set<String> symbols() {
        return subscribedSymbols;
    }

    @Override
    public String toString() {
        return "ClientConnection{id=" + getId() + ", userId=" + identity.userId() + ", symbols="
                + subscribedSymbols.size() + "}";
    }
}
