package com.pricestream.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.pricestream.api.websocket.ClientMessageHandler;
import com.pricestream.api.websocket.PriceStreamWebSocketHandler;
import com.pricestream.dispatch.BroadcastDispatcher;
import com.pricestream.domain.enums.SubscriptionTier;
import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.observability.PriceStreamMetrics;
import com.pricestream.pricesource.LatestPriceBook;
import com.pricestream.ratelimit.InMemoryRateLimitStore;
import com.pricestream.ratelimit.RateLimitConfig;
import com.pricestream.ratelimit.RateLimiter;
import com.pricestream.subscription.ConnectionConfig;
import com.pricestream.subscription.SubscriptionRegistry;
import com.pricestream.support.MutableClock;
import com.pricestream.support.StubPriceSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class PriceStreamWebSocketHandlerTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private ConnectionConfig connectionConfig;
    private SubscriptionRegistry registry;
    private PriceStreamWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpochMillis(0);
        connectionConfig = new ConnectionConfig();
        connectionConfig.setMaxConnections(2);
        registry = new SubscriptionRegistry(connectionConfig, new StubPriceSource(), clock);
        BroadcastDispatcher dispatcher = new BroadcastDispatcher(registry, objectMapper);
        PriceStreamMetrics metrics = new PriceStreamMetrics(new SimpleMeterRegistry(), registry);
        RateLimiter rateLimiter =
                new RateLimiter(new InMemoryRateLimitStore(clock), new RateLimitConfig(), clock, metrics);
        ClientMessageHandler messageHandler =
                new ClientMessageHandler(registry, dispatcher, rateLimiter, new LatestPriceBook(), objectMapper);
        handler = new PriceStreamWebSocketHandler(registry, messageHandler, dispatcher, connectionConfig);
    }

    private WebSocketSession session(String id, CallerIdentity identity) {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        if (identity != null) {
            attributes.put(CallerIdentity.ATTRIBUTE, identity);
        }
        when(session.getId()).thenReturn(id);
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
        when(session.getRemoteAddress()).thenReturn(new InetSocketAddress("127.0.0.1", 50000));
        return session;
    }

    private List<JsonNode> sentTo(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            messages.add(objectMapper.readTree(message.getPayload()));
        }
        return messages;
    }

    @Test
    @DisplayName("a new connection is registered with its identity and greeted with an empty subscription")
    void registersAndGreets() throws Exception {
        WebSocketSession session = session("s1", new CallerIdentity("alice", SubscriptionTier.PRO, "10.0.0.1"));

        handler.afterConnectionEstablished(session);

        assertThat(registry.find("s1")).isPresent();
        assertThat(registry.find("s1").orElseThrow().getUserId()).isEqualTo("alice");
        JsonNode greeting = sentTo(session).get(0);
        assertThat(greeting.get("type").asText()).isEqualTo("subscribed");
        assertThat(greeting.get("symbols")).isEmpty();
    }

    @Test
    @DisplayName("a connection without a resolved identity is anonymous")
    void anonymousWithoutIdentity() {
        WebSocketSession session = session("s1", null);

        handler.afterConnectionEstablished(session);

        assertThat(registry.find("s1").orElseThrow().getIdentity().isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("connections beyond capacity get an error and are closed")
    void rejectsOverCapacity() throws Exception {
        handler.afterConnectionEstablished(session("s1", null));
        handler.afterConnectionEstablished(session("s2", null));
        WebSocketSession third = session("s3", null);

        handler.afterConnectionEstablished(third);

        assertThat(registry.connectionCount()).isEqualTo(2);
        JsonNode error = sentTo(third).get(0);
        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(error.get("code").asText()).isEqualTo("CAPACITY_EXCEEDED");
        verify(third).close(any(CloseStatus.class));
    }

    @Test
    @DisplayName("connections during shutdown are refused")
    void rejectsWhileDraining() throws Exception {
        registry.drain();
        WebSocketSession session = session("s1", null);

        handler.afterConnectionEstablished(session);

        assertThat(registry.connectionCount()).isZero();
        assertThat(sentTo(session).get(0).get("code").asText()).isEqualTo("SERVICE_UNAVAILABLE");
    }

    @Test
    @DisplayName("text frames reach the message handler")
    void routesTextFrames() throws Exception {
        WebSocketSession session = session("s1", null);
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"subscribe\",\"symbols\":[\"ETH\"]}"));

        assertThat(registry.subscriptionsOf("s1")).containsExactly("ETH");
    }

    @Test
    @DisplayName("binary frames are decoded and handled without closing the connection")
    void routesBinaryFrames() throws Exception {
        WebSocketSession session = session("s1", null);
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new BinaryMessage(
                "{\"type\":\"subscribe\",\"symbols\":[\"BTC\"]}".getBytes(StandardCharsets.UTF_8)));

        assertThat(registry.subscriptionsOf("s1")).containsExactly("BTC");
        verify(session, never()).close(any(CloseStatus.class));
        verify(session, never()).close();
    }

    @Test
    @DisplayName("malformed binary frames get a parse error and the connection stays open")
    void malformedBinaryFrameReportsError() throws Exception {
        WebSocketSession session = session("s1", null);
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new BinaryMessage(new byte[] {0x01, 0x02, (byte) 0xff}));

        List<JsonNode> messages = sentTo(session);
        JsonNode last = messages.get(messages.size() - 1);
        assertThat(last.get("type").asText()).isEqualTo("error");
        assertThat(last.get("code").asText()).isEqualTo("PARSE_ERROR");
        assertThat(registry.find("s1")).isPresent();
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    @DisplayName("close and transport errors deregister the connection")
    void closeDeregisters() throws Exception {
        WebSocketSession first = session("s1", null);
        WebSocketSession second = session("s2", null);
        handler.afterConnectionEstablished(first);
        handler.afterConnectionEstablished(second);
        handler.handleMessage(first, new TextMessage("{\"type\":\"subscribe\",\"symbols\":[\"BTC\"]}"));

        handler.afterConnectionClosed(first, CloseStatus.NORMAL);
        handler.handleTransportError(second, new IOException("reset by peer"));

        assertThat(registry.connectionCount()).isZero();
        assertThat(registry.subscribedSymbols()).isEmpty();
        verify(first, never()).close(any(CloseStatus.class));
    }
}
