package com.pricestream.api.websocket;

import com.pricestream.dispatch.BroadcastDispatcher;
import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.CapacityExceededException;
import com.pricestream.subscription.ConnectionConfig;
import com.pricestream.subscription.ConnectionTransport;
import com.pricestream.subscription.SubscriptionRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint adapter for the price stream.
 *
 * <p>On connect the session is wrapped in a {@link WebSocketSessionTransport}, registered
 * and greeted with an empty {@code subscribed} message. Rejected connections (capacity,
 * shutdown) get an {@code error} message and are closed. Frames are handed to the
 * {@link ClientMessageHandler}; binary frames are decoded as UTF-8 and handled the same way.
 * Close and transport errors deregister the connection.
 */
@Component
public class PriceStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PriceStreamWebSocketHandler.class);

    static final String TRANSPORT_ATTRIBUTE = "pricestream.transport";

    private final SubscriptionRegistry registry;
    private final ClientMessageHandler clientMessageHandler;
    private final BroadcastDispatcher dispatcher;
    private final ConnectionConfig connectionConfig;

    public PriceStreamWebSocketHandler(
            SubscriptionRegistry registry,
            ClientMessageHandler clientMessageHandler,
            BroadcastDispatcher dispatcher,
            ConnectionConfig connectionConfig) {
        this.registry = registry;
        this.clientMessageHandler = clientMessageHandler;
        this.dispatcher = dispatcher;
        this.connectionConfig = connectionConfig;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSessionTransport transport = new WebSocketSessionTransport(
                session, connectionConfig.getSendTimeLimitMs(), connectionConfig.getSendBufferBytes());
        session.getAttributes().put(TRANSPORT_ATTRIBUTE, transport);

        Object resolved = session.getAttributes().get(CallerIdentity.ATTRIBUTE);
        CallerIdentity identity = resolved instanceof CallerIdentity callerIdentity
                ? callerIdentity
                : CallerIdentity.anonymous(transport.remoteAddress());

        try {
            registry.register(transport, identity);
        } catch (CapacityExceededException e) {
            log.warn("Rejecting WebSocket connection {}: {}", session.getId(), e.getMessage());
            reject(transport, e.getMessage(), StreamErrorCode.CAPACITY_EXCEEDED);
            return;
        } catch (BusinessException e) {
            log.info("Rejecting WebSocket connection {}: {}", session.getId(), e.getMessage());
            reject(transport, e.getMessage(), StreamErrorCode.SERVICE_UNAVAILABLE);
            return;
        }

        dispatcher.send(transport.id(), WebSocketMessage.subscribed(List.of()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionTransport transport = transportOf(session);
        if (transport != null) {
            clientMessageHandler.handle(transport, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ConnectionTransport transport = transportOf(session);
        if (transport != null) {
            String payload = StandardCharsets.UTF_8.decode(message.getPayload().duplicate()).toString();
            clientMessageHandler.handle(transport, payload);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        registry.deregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.deregister(session.getId());
        log.debug("WebSocket session {} closed: {}", session.getId(), status);
    }

    private void reject(ConnectionTransport transport, String message, StreamErrorCode code) {
        dispatcher.sendUnregistered(transport, WebSocketMessage.error(message, code));
        transport.close(message);
    }

    private static ConnectionTransport transportOf(WebSocketSession session) {
        Object transport = session.getAttributes().get(TRANSPORT_ATTRIBUTE);
        return transport instanceof ConnectionTransport connectionTransport ? connectionTransport : null;
    }
}
