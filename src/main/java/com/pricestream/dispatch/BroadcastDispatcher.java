package com.pricestream.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricestream.api.websocket.WebSocketMessage;
import com.pricestream.domain.model.Alert;
import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.subscription.ClientConnection;
import com.pricestream.subscription.ConnectionTransport;
import com.pricestream.subscription.SendResult;
import com.pricestream.subscription.SubscriptionRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pushes outbound messages to registered connections.
 *
 * <p>Price updates go to connections subscribed to the symbol; alert notifications go to
 * every connection of the alert's owner regardless of subscriptions. Each message is
 * serialized once and the same payload is written to every target. A send that reports
 * {@link SendResult#CLOSED} deregisters that connection on the spot; there is no retry.
 *
 * <p>Delivery runs on the caller's thread, outside the registry lock. Ordering per
 * connection is kept by {@link ClientConnection#deliver}.
 */
@Component
public class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final SubscriptionRegistry registry;
    private final ObjectMapper objectMapper;

    public BroadcastDispatcher(SubscriptionRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /** Delivers a {@code price_update} to every subscriber of the snapshot's symbol. */
    public int broadcastPrice(PriceSnapshot snapshot) {
        List<ClientConnection> targets = registry.connectionsInterestedIn(snapshot.getSymbol());
        if (targets.isEmpty()) {
            return 0;
        }

        String payload = serialize(WebSocketMessage.priceUpdate(snapshot));
        int delivered = 0;
        for (ClientConnection connection : targets) {
            if (deliver(connection, payload)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} price to {}/{} connections", snapshot.getSymbol(), delivered, targets.size());
        return delivered;
    }

    /**
     * Delivers {@code alert_triggered} followed by the current {@code price_update} to
     * every connection owned by the alert's user. Returns the number of connections that
     * received the alert.
     */
    public int notifyAlertTriggered(Alert alert, PriceSnapshot snapshot) {
        List<ClientConnection> owners = registry.connectionsOwnedBy(alert.getUserId());
        if (owners.isEmpty()) {
            log.debug("Alert {} triggered but user {} has no open connections", alert.getId(), alert.getUserId());
            return 0;
        }

        String alertPayload = serialize(WebSocketMessage.alertTriggered(alert));
        String pricePayload = serialize(WebSocketMessage.priceUpdate(snapshot));
        int delivered = 0;
        for (ClientConnection connection : owners) {
            if (deliver(connection, alertPayload)) {
                delivered++;
                deliver(connection, pricePayload);
            }
        }
        return delivered;
    }

    /** Direct reply to one registered connection. Returns false when it is gone. */
    public boolean send(String connectionId, WebSocketMessage message) {
        return registry.find(connectionId)
                .map(connection -> deliver(connection, serialize(message)))
                .orElse(false);
    }

    /** Raw text reply, used for heartbeat {@code pong}. */
    public boolean sendText(String connectionId, String text) {
        return registry.find(connectionId)
                .map(connection -> deliver(connection, text))
                .orElse(false);
    }

    /** Writes to a transport that is not (or no longer) registered, e.g. to explain a rejection. */
    public SendResult sendUnregistered(ConnectionTransport transport, WebSocketMessage message) {
        return transport.send(serialize(message));
    }

    private boolean deliver(ClientConnection connection, String payload) {
        if (connection.deliver(payload) == SendResult.OK) {
            return true;
        }
        log.debug("Send to {} failed, deregistering", connection.getId());
        registry.deregister(connection.getId());
        return false;
    }

    private String serialize(WebSocketMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.getType() + " message", e);
        }
    }
}
