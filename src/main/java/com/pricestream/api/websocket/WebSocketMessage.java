package com.pricestream.api.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pricestream.domain.model.Alert;
import com.pricestream.domain.model.PriceSnapshot;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound message envelope for the price stream.
 *
 * <p>Message types:
 * <ul>
 *   <li>{@code subscribed} / {@code unsubscribed}: confirmation carrying {@code symbols}</li>
 *   <li>{@code price_update}: {@code data} is a {@link PriceSnapshot}</li>
 *   <li>{@code alert_triggered}: {@code data} is the triggered {@link Alert}</li>
 *   <li>{@code error}: {@code message} plus an optional {@code code}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketMessage {

    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String PRICE_UPDATE = "price_update";
    public static final String ALERT_TRIGGERED = "alert_triggered";
    public static final String ERROR = "error";

    private String type;
    private List<String> symbols;
    private Object data;
    private String message;
    private String code;

    public static WebSocketMessage subscribed(List<String> symbols) {
        return WebSocketMessage.builder().type(SUBSCRIBED).symbols(symbols).build();
    }

    public static WebSocketMessage unsubscribed(List<String> symbols) {
        return WebSocketMessage.builder().type(UNSUBSCRIBED).symbols(symbols).build();
    }

    public static WebSocketMessage priceUpdate(PriceSnapshot snapshot) {
        return WebSocketMessage.builder().type(PRICE_UPDATE).data(snapshot).build();
    }

    public static WebSocketMessage alertTriggered(Alert alert) {
        return WebSocketMessage.builder().type(ALERT_TRIGGERED).data(alert).build();
    }

    public static WebSocketMessage error(String message, StreamErrorCode code) {
        return WebSocketMessage.builder()
                .type(ERROR)
                .message(message)
                .code(code != null ? code.name() : null)
                .build();
    }
}
