package com.pricestream.ratelimit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed sliding-window store. Each key is a sorted set of admitted requests
 * scored by timestamp. The expire-count-record sequence runs as one Lua script so
 * concurrent instances never over-admit.
 *
 * <p>Key TTL is refreshed to the window length on every admission, so idle keys expire
 * on their own.
 */
public class RedisRateLimitStore implements RateLimitStore {

    // KEYS[1] = window key; ARGV = now, windowMs, limit, member
    // Returns {admitted(0|1), count, oldestScore}
    private static final String SLIDING_WINDOW_SCRIPT = """
            local key = KEYS[1]
            local now = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            local limit = tonumber(ARGV[3])
            redis.call('ZREMRANGEBYSCORE', key, '-inf', now - window)
            local count = redis.call('ZCARD', key)
            local admitted = 0
            if count < limit then
                redis.call('ZADD', key, now, ARGV[4])
                redis.call('PEXPIRE', key, window)
                count = count + 1
                admitted = 1
            end
            local oldest = now
            local first = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            if first[2] then
                oldest = tonumber(first[2])
            end
            return {admitted, count, oldest}
            """;

    private static final RedisScript<List<Long>> SCRIPT = slidingWindowScript();

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public WindowState acquire(String key, int limit, long windowMs, long nowMs) {
        String member = nowMs + ":" + UUID.randomUUID();
        List<Long> reply = redisTemplate.execute(
                SCRIPT,
                List.of(keyPrefix + key),
                String.valueOf(nowMs),
                String.valueOf(windowMs),
                String.valueOf(limit),
                member);
        if (reply == null || reply.size() < 3) {
            throw new IllegalStateException("Unexpected rate limit script reply for key " + key + ": " + reply);
        }
        return new WindowState(reply.get(0) == 1L, reply.get(1).intValue(), reply.get(2));
    }

    // ---- Internal ----

    @SuppressWarnings("unchecked")
    private static RedisScript<List<Long>> slidingWindowScript() {
        DefaultRedisScript<List<Long>> script = new DefaultRedisScript<>();
        script.setScriptText(SLIDING_WINDOW_SCRIPT);
        script.setResultType((Class<List<Long>>) (Class<?>) List.class);
        return script;
    }
}
