package com.pricestream.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.pricestream.api.websocket.CallerIdentityHandshakeInterceptor;
import com.pricestream.domain.enums.SubscriptionTier;
import com.pricestream.domain.model.CallerIdentity;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class CallerIdentityHandshakeInterceptorTest {

    private final CallerIdentityHandshakeInterceptor interceptor = new CallerIdentityHandshakeInterceptor();

    private CallerIdentity handshake(String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws");
        request.setQueryString(query);
        request.setRemoteAddr("203.0.113.7");
        request.setRemoteHost("203.0.113.7");
        Map<String, Object> attributes = new HashMap<>();

        boolean proceed = interceptor.beforeHandshake(
                new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()),
                mock(WebSocketHandler.class),
                attributes);

        assertThat(proceed).isTrue();
        return (CallerIdentity) attributes.get(CallerIdentity.ATTRIBUTE);
    }

    @Test
    @DisplayName("user id and tier come from the query string")
    void authenticatedCaller() {
        CallerIdentity identity = handshake("userId=user%40example.com&tier=enterprise");

        assertThat(identity.userId()).isEqualTo("user@example.com");
        assertThat(identity.tier()).isEqualTo(SubscriptionTier.ENTERPRISE);
        assertThat(identity.remoteAddress()).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("missing user id gives an anonymous free caller keyed by address")
    void anonymousCaller() {
        CallerIdentity identity = handshake("tier=pro");

        assertThat(identity.isAuthenticated()).isFalse();
        assertThat(identity.tier()).isEqualTo(SubscriptionTier.FREE);
        assertThat(identity.remoteAddress()).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("an unknown tier falls back to free")
    void unknownTier() {
        assertThat(handshake("userId=alice&tier=platinum").tier()).isEqualTo(SubscriptionTier.FREE);
    }
}
