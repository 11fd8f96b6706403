package com.pricestream.exception;

import java.util.Map;

/**
 * Thrown when a hard capacity limit rejects a request outright, such as the global
 * WebSocket connection cap. The rejected request has no partial effect.
 */
public class CapacityExceededException extends BaseException {

    public CapacityExceededException(String message, int limit) {
        super(ErrorCode.CAPACITY_EXCEEDED, message, Map.of("limit", limit));
    }
}
