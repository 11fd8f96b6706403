package com.pricestream.api.websocket;

/** Codes carried by outbound {@code error} messages on the WebSocket stream. */
public enum StreamErrorCode {
    INVALID_MESSAGE,
    PARSE_ERROR,
    INVALID_SYMBOLS,
    RATE_LIMIT_EXCEEDED,
    CONNECTION_ERROR,
    CAPACITY_EXCEEDED,
    SERVICE_UNAVAILABLE
}
