package com.pricestream.exception;

import com.pricestream.ratelimit.RateLimitResult;
import java.util.Map;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends BaseException {

    private final RateLimitResult result;

    public RateLimitExceededException(String message, RateLimitResult result, long retryAfterSeconds) {
        super(
                ErrorCode.RATE_LIMIT_EXCEEDED,
                message,
                Map.of("retryAfter", retryAfterSeconds, "limit", result.limit(), "windowMs", result.windowMs()));
        this.result = result;
    }
}
