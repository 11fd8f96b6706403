package com.pricestream.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_SYMBOL("INVALID_SYMBOL", 400),
    INVALID_SYMBOLS("INVALID_SYMBOLS", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    ALERT_LIMIT_REACHED("ALERT_LIMIT_REACHED", 403),
    NOT_FOUND("NOT_FOUND", 404),
    SYMBOL_NOT_FOUND("SYMBOL_NOT_FOUND", 404),
    UPDATE_IN_PROGRESS("UPDATE_IN_PROGRESS", 409),
    RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED", 429),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 503),
    CAPACITY_EXCEEDED("CAPACITY_EXCEEDED", 503),
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
