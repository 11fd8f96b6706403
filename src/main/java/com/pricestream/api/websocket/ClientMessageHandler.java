package com.pricestream.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricestream.dispatch.BroadcastDispatcher;
import com.pricestream.exception.ResourceNotFoundException;
import com.pricestream.pricesource.LatestPriceBook;
import com.pricestream.ratelimit.RateLimitResult;
import com.pricestream.ratelimit.RateLimiter;
import com.pricestream.subscription.ClientConnection;
import com.pricestream.subscription.ConnectionTransport;
import com.pricestream.subscription.SubscriptionRegistry;
import com.pricestream.subscription.SubscriptionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles one inbound text frame from a client.
 *
 * <p>Heartbeat {@code ping} frames refresh the connection and are answered with
 * {@code pong}. Every other frame passes the standard rate limit, is parsed and
 * validated, and is routed to the registry. Problems are reported back as {@code error}
 * messages; the connection is never closed because of a bad message.
 *
 * <p>Accepted inbound shape: {@code {"type": "subscribe"|"unsubscribe", "symbols": [..]}}
 * with 1 to 10 characters per symbol.
 */
@Component
public class ClientMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(ClientMessageHandler.class);

    static final String PING = "ping";
    static final String PONG = "pong";
    static final int MAX_SYMBOL_LENGTH = 10;

    private final SubscriptionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final RateLimiter rateLimiter;
    private final LatestPriceBook latestPriceBook;
    private final ObjectMapper objectMapper;

    public ClientMessageHandler(
            SubscriptionRegistry registry,
            BroadcastDispatcher dispatcher,
            RateLimiter rateLimiter,
            LatestPriceBook latestPriceBook,
            ObjectMapper objectMapper) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.rateLimiter = rateLimiter;
        this.latestPriceBook = latestPriceBook;
        this.objectMapper = objectMapper;
    }

    public void handle(ConnectionTransport transport, String payload) {
        String connectionId = transport.id();
        Optional<ClientConnection> connection = registry.find(connectionId);
        if (connection.isEmpty()) {
            dispatcher.sendUnregistered(
                    transport, WebSocketMessage.error("Connection not found", StreamErrorCode.CONNECTION_ERROR));
            return;
        }

        if (PING.equals(payload)) {
            registry.touch(connectionId);
            dispatcher.sendText(connectionId, PONG);
            return;
        }
        registry.touch(connectionId);

        RateLimitResult limit = rateLimiter.checkStandard(connection.get().getIdentity());
        if (!limit.allowed()) {
            reply(connectionId, "Too many requests. Please try again later.", StreamErrorCode.RATE_LIMIT_EXCEEDED);
            return;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable message from {}: {}", connectionId, e.getOriginalMessage());
            reply(connectionId, "Failed to parse message", StreamErrorCode.PARSE_ERROR);
            return;
        }

        Optional<ClientRequest> request = ClientRequest.from(root);
        if (request.isEmpty()) {
            reply(connectionId, "Invalid message format", StreamErrorCode.INVALID_MESSAGE);
            return;
        }

        try {
            switch (request.get().type()) {
                case SUBSCRIBE -> handleSubscribe(connectionId, request.get().symbols());
                case UNSUBSCRIBE -> handleUnsubscribe(connectionId, request.get().symbols());
            }
        } catch (ResourceNotFoundException e) {
            // Disconnected between lookup and mutation
            log.debug("Connection {} went away while handling {}", connectionId, request.get().type());
        }
    }

    // ---- Internal ----

    private void handleSubscribe(String connectionId, List<String> symbols) {
        SubscriptionResult result = registry.subscribe(connectionId, symbols);
        if (result.hasUnsupported()) {
            reply(
                    connectionId,
                    "Unsupported symbols: " + String.join(", ", result.unsupported()),
                    StreamErrorCode.INVALID_SYMBOLS);
        }
        dispatcher.send(connectionId, WebSocketMessage.subscribed(result.subscribed()));

        for (String symbol : result.applied()) {
            latestPriceBook.get(symbol)
                    .ifPresent(snapshot -> dispatcher.send(connectionId, WebSocketMessage.priceUpdate(snapshot)));
        }
    }

    private void handleUnsubscribe(String connectionId, List<String> symbols) {
        List<String> removed = registry.unsubscribe(connectionId, symbols);
        dispatcher.send(connectionId, WebSocketMessage.unsubscribed(removed));
    }

    private void reply(String connectionId, String message, StreamErrorCode code) {
        dispatcher.send(connectionId, WebSocketMessage.error(message, code));
    }

    enum RequestType {
        SUBSCRIBE,
        UNSUBSCRIBE
    }

    record ClientRequest(RequestType type, List<String> symbols) {

        static Optional<ClientRequest> from(JsonNode root) {
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            JsonNode type = root.get("type");
            JsonNode symbols = root.get("symbols");
            if (type == null || !type.isTextual() || symbols == null || !symbols.isArray()) {
                return Optional.empty();
            }

            RequestType requestType;
            switch (type.asText()) {
                case "subscribe" -> requestType = RequestType.SUBSCRIBE;
                case "unsubscribe" -> requestType = RequestType.UNSUBSCRIBE;
                default -> {
                    return Optional.empty();
                }
            }

            List<String> values = new ArrayList<>();
            for (JsonNode symbol : symbols) {
                if (!symbol.isTextual()) {
                    return Optional.empty();
                }
                String value = symbol.asText();
                if (value.isEmpty() || value.length() > MAX_SYMBOL_LENGTH) {
                    return Optional.empty();
                }
                values.add(value);
            }
            return Optional.of(new ClientRequest(requestType, values));
        }
    }
}
