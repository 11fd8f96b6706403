package com.pricestream.subscription;

import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.CapacityExceededException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.ResourceNotFoundException;
import com.pricestream.pricesource.PriceSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Source of truth for live client connections and the symbols each one wants.
 *
 * <p>Two structures are kept: the connection records (each holding its own subscribed
 * set) and a reverse index from symbol to connection ids. Both are guarded by one
 * {@link ReentrantReadWriteLock}; every mutation updates both under the write lock, so a
 * connection id is in {@code symbolInterest[s]} exactly when {@code s} is in that
 * connection's set. Empty interest sets are removed.
 *
 * <p>Read paths used by the broadcast loop ({@link #connectionsInterestedIn},
 * {@link #connectionsOwnedBy}) copy a snapshot under the read lock and return it; callers
 * deliver outside the lock. A connection that disappears between snapshot and delivery
 * shows up as a CLOSED send and is deregistered by the dispatcher.
 *
 * <p>Symbols are normalized (trimmed, upper-cased) and filtered against the price
 * source's supported set before they reach either structure.
 */
@Component
@EnableConfigurationProperties(ConnectionConfig.class)
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, ClientConnection> connections = new HashMap<>();
    private final Map<String, Set<String>> symbolInterest = new HashMap<>();

    private final ConnectionConfig config;
    private final Set<String> supportedSymbols;
    private final Clock clock;

    private volatile boolean accepting = true;

    public SubscriptionRegistry(ConnectionConfig config, PriceSource priceSource, Clock clock) {
        this.config = config;
        this.supportedSymbols = Set.copyOf(priceSource.supportedSymbols());
        this.clock = clock;
    }

    /**
     * Admits a connection with an empty interest set.
     *
     * @throws CapacityExceededException when the global connection cap is reached
     * @throws BusinessException with SERVICE_UNAVAILABLE once the registry is draining
     */
    public ClientConnection register(ConnectionTransport transport, CallerIdentity identity) {
        ClientConnection connection;
        int total;
        lock.writeLock().lock();
        try {
            if (!accepting) {
                throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, "Server is shutting down");
            }
            ClientConnection existing = connections.get(transport.id());
            if (existing != null) {
                return existing;
            }
            if (connections.size() >= config.getMaxConnections()) {
                throw new CapacityExceededException("Connection limit reached", config.getMaxConnections());
            }
            connection = new ClientConnection(transport, identity, clock.millis());
            connections.put(connection.getId(), connection);
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        log.info(
                "Client connected: {} (user={}, tier={}, address={}, total={})",
                connection.getId(),
                identity.userId(),
                identity.tier().getValue(),
                identity.remoteAddress(),
                total);
        return connection;
    }

    /**
     * Subscribes a connection to the supported subset of {@code symbols}. Already
     * subscribed symbols are accepted again without effect.
     *
     * @throws ResourceNotFoundException when the connection is not registered
     */
    public SubscriptionResult subscribe(String connectionId, Collection<String> symbols) {
        List<String> applied = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        for (String symbol : normalize(symbols)) {
            if (supportedSymbols.contains(symbol)) {
                applied.add(symbol);
            } else {
                unsupported.add(symbol);
            }
        }

        List<String> subscribed;
        lock.writeLock().lock();
        try {
            ClientConnection connection = require(connectionId);
            for (String symbol : applied) {
                if (connection.addSymbol(symbol)) {
                    symbolInterest.computeIfAbsent(symbol, s -> new HashSet<>()).add(connectionId);
                }
            }
            connection.markActive(clock.millis());
            subscribed = List.copyOf(new TreeSet<>(connection.symbols()));
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Connection {} subscribed to {} (unsupported: {})", connectionId, applied, unsupported);
        return new SubscriptionResult(List.copyOf(applied), List.copyOf(unsupported), subscribed);
    }

    /**
     * Removes {@code symbols} from a connection's subscriptions. Symbols it was not
     * subscribed to are ignored.
     *
     * @return the normalized symbols requested for removal
     * @throws ResourceNotFoundException when the connection is not registered
     */
    public List<String> unsubscribe(String connectionId, Collection<String> symbols) {
        List<String> removed = List.copyOf(normalize(symbols));
        lock.writeLock().lock();
        try {
            ClientConnection connection = require(connectionId);
            for (String symbol : removed) {
                if (connection.removeSymbol(symbol)) {
                    dropInterest(symbol, connectionId);
                }
            }
            connection.markActive(clock.millis());
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Connection {} unsubscribed from {}", connectionId, removed);
        return removed;
    }

    /**
     * Removes a connection from every interest set and drops its record. Safe to call
     * more than once and from several threads; only the first call returns the record.
     */
    public Optional<ClientConnection> deregister(String connectionId) {
        ClientConnection connection;
        int total;
        lock.writeLock().lock();
        try {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return Optional.empty();
            }
            for (String symbol : connection.symbols()) {
                dropInterest(symbol, connectionId);
            }
            connection.symbols().clear();
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Client disconnected: {} (total={})", connectionId, total);
        return Optional.of(connection);
    }

    public List<ClientConnection> connectionsInterestedIn(String symbol) {
        if (symbol == null) {
            return List.of();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        lock.readLock().lock();
        try {
            Set<String> ids = symbolInterest.get(normalized);
            if (ids == null) {
                return List.of();
            }
            return ids.stream().map(connections::get).filter(Objects::nonNull).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ClientConnection> connectionsOwnedBy(String userId) {
        if (userId == null) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return connections.values().stream()
                    .filter(connection -> userId.equals(connection.getUserId()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Connections silent for longer than {@code maxAgeMs}. */
    public List<ClientConnection> staleConnections(long maxAgeMs) {
        long cutoff = clock.millis() - maxAgeMs;
        lock.readLock().lock();
        try {
            return connections.values().stream()
                    .filter(connection -> connection.getLastActivityMillis() < cutoff)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Records heartbeat activity. Returns false when the connection is not registered. */
    public boolean touch(String connectionId) {
        lock.readLock().lock();
        try {
            ClientConnection connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            connection.markActive(clock.millis());
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops accepting registrations, clears both structures and closes every connection
     * that was registered. Returns the number of connections closed.
     */
    public int drain() {
        List<ClientConnection> drained;
        lock.writeLock().lock();
        try {
            accepting = false;
            drained = new ArrayList<>(connections.values());
            connections.clear();
            symbolInterest.clear();
        } finally {
            lock.writeLock().unlock();
        }

        for (ClientConnection connection : drained) {
            connection.close("Server shutting down");
        }
        log.info("Subscription registry drained, closed {} connections", drained.size());
        return drained.size();
    }

    public Optional<ClientConnection> find(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> connectionIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Symbols with at least one interested connection, sorted. */
    public List<String> subscribedSymbols() {
        lock.readLock().lock();
        try {
            return List.copyOf(new TreeSet<>(symbolInterest.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The connection ids interested in {@code symbol}, as held by the reverse index. */
    public Set<String> interestedConnectionIds(String symbol) {
        lock.readLock().lock();
        try {
            Set<String> ids = symbolInterest.get(symbol);
            return ids == null ? Set.of() : Set.copyOf(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** A connection's subscribed symbols; empty when the connection is not registered. */
    public Set<String> subscriptionsOf(String connectionId) {
        lock.readLock().lock();
        try {
            ClientConnection connection = connections.get(connectionId);
            return connection == null ? Set.of() : Set.copyOf(connection.symbols());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getSupportedSymbols() {
        return supportedSymbols;
    }

    public boolean isAccepting() {
        return accepting;
    }

    private ClientConnection require(String connectionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection == null) {
            throw new ResourceNotFoundException("Connection", connectionId);
        }
        return connection;
    }

    private void dropInterest(String symbol, String connectionId) {
        Set<String> ids = symbolInterest.get(symbol);
        if (ids != null) {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                symbolInterest.remove(symbol);
            }
        }
    }

    private static Set<String> normalize(Collection<String> symbols) {
        Set<String> normalized = new LinkedHashSet<>();
        if (symbols == null) {
            return normalized;
        }
        for (String symbol : symbols) {
            if (symbol == null) {
                continue;
            }
            String trimmed = symbol.trim().toUpperCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed);
            }
        }
        return normalized;
    }
}
