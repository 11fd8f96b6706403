package com.pricestream.api.websocket;

import com.pricestream.domain.model.CallerIdentity;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Resolves the caller for a WebSocket handshake from the {@code userId} and {@code tier}
 * query parameters set by the upstream gateway, and stores it as a session attribute.
 * Connections without a user id are anonymous.
 */
@Component
public class CallerIdentityHandshakeInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        MultiValueMap<String, String> params =
                UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        InetSocketAddress remote = request.getRemoteAddress();
        String address = remote != null && remote.getAddress() != null
                ? remote.getAddress().getHostAddress()
                : null;

        attributes.put(
                CallerIdentity.ATTRIBUTE,
                CallerIdentity.resolve(decoded(params, "userId"), decoded(params, "tier"), address));
        return true;
    }

    private static String decoded(MultiValueMap<String, String> params, String name) {
        String value = params.getFirst(name);
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler, Exception exception) {
        // nothing to do after the upgrade
    }
}
