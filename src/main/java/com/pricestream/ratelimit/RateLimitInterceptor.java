package com.pricestream.ratelimit;

import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the caller from gateway headers and applies the standard limit to every API
 * request, plus the strict limit on methods annotated with {@link StrictRateLimit}.
 *
 * <p>The resolved {@link CallerIdentity} is stored as a request attribute for controllers.
 * Rejections surface as {@link RateLimitExceededException}, which the global handler turns
 * into a 429 with {@code Retry-After}.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_TIER_HEADER = "X-User-Tier";

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimiter rateLimiter;
    private final Clock clock;

    public RateLimitInterceptor(RateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        CallerIdentity identity = CallerIdentity.resolve(
                request.getHeader(USER_ID_HEADER), request.getHeader(USER_TIER_HEADER), request.getRemoteAddr());
        request.setAttribute(CallerIdentity.ATTRIBUTE, identity);

        RateLimitResult standard = rateLimiter.checkStandard(identity);
        writeHeaders(response, standard);
        if (!standard.allowed()) {
            throw rejection("Too many requests. Please try again later.", standard);
        }

        if (handler instanceof HandlerMethod handlerMethod && handlerMethod.hasMethodAnnotation(StrictRateLimit.class)) {
            RateLimitResult strict = rateLimiter.checkStrict(identity);
            if (!strict.allowed()) {
                writeHeaders(response, strict);
                throw rejection("Too many requests for this operation. Please try again later.", strict);
            }
        }
        return true;
    }

    private RateLimitExceededException rejection(String message, RateLimitResult result) {
        return new RateLimitExceededException(message, result, result.retryAfterSeconds(clock.millis()));
    }

    private void writeHeaders(HttpServletResponse response, RateLimitResult result) {
        response.setHeader(LIMIT_HEADER, String.valueOf(result.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(result.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(result.resetAtEpochSeconds()));
    }
}
