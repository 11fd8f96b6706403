package com.pricestream.api.websocket;

import com.pricestream.subscription.ConnectionTransport;
import com.pricestream.subscription.SendResult;
import java.io.IOException;
import java.net.InetSocketAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * {@link ConnectionTransport} over a Spring {@link WebSocketSession}.
 *
 * <p>The session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}, which
 * serializes concurrent sends in order and terminates the session when a slow client
 * exceeds the send time or buffer limit. Any send failure is reported as
 * {@link SendResult#CLOSED}.
 */
public class WebSocketSessionTransport implements ConnectionTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionTransport.class);

    private final WebSocketSession session;
    private final String remoteAddress;

    public WebSocketSessionTransport(WebSocketSession session, int sendTimeLimitMs, int sendBufferBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferBytes);
        this.remoteAddress = resolveAddress(session.getRemoteAddress());
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public SendResult send(String text) {
        if (!session.isOpen()) {
            return SendResult.CLOSED;
        }
        try {
            session.sendMessage(new TextMessage(text));
            return SendResult.OK;
        } catch (SessionLimitExceededException e) {
            log.warn("Closing slow WebSocket client {}: {}", session.getId(), e.getMessage());
            return SendResult.CLOSED;
        } catch (IOException | IllegalStateException e) {
            log.debug("Send to WebSocket session {} failed: {}", session.getId(), e.getMessage());
            return SendResult.CLOSED;
        }
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL.withReason(reason));
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    private static String resolveAddress(InetSocketAddress address) {
        if (address == null) {
            return "unknown";
        }
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }
}
