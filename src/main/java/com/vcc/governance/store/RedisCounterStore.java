package com.vcc.governance.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed counters.
 * INCRBY and the expiry-on-create run inside one Lua script, so the increment is atomic
 * and a counter never lives without a TTL.
 */
public class RedisCounterStore implements CounterStore {
    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    private static final RedisScript<Long> INCREMENT_WITH_EXPIRY = new DefaultRedisScript<>(
            "local value = redis.call('INCRBY', KEYS[1], ARGV[1]) " +
            "if value == tonumber(ARGV[1]) then " +
            "  redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
            "end " +
            "return value",
            Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;

    public RedisCounterStore(ReactiveStringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<Long> incrementWithExpiry(String key, long delta, Duration ttl) {
        return redisTemplate.execute(
                        INCREMENT_WITH_EXPIRY,
                        List.of(key),
                        List.of(String.valueOf(delta), String.valueOf(Math.max(1, ttl.toMillis()))))
                .next()
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty reply incrementing " + key)))
                .doOnNext(value -> log.trace("INCRBY {} {} -> {}", key, delta, value));
    }

    @Override
    public Mono<Long> get(String key) {
        return redisTemplate.opsForValue().get(key)
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }
}
