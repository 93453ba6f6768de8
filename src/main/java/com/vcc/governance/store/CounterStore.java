package com.vcc.governance.store;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Externally hosted, atomically incrementable counters.
 * Implementations must make {@link #incrementWithExpiry} a single atomic operation:
 * concurrent callers on the same key each observe a distinct post-increment value.
 */
public interface CounterStore {

    /**
     * Add {@code delta} to the counter, creating it with the given time-to-live when absent.
     *
     * @return the value after the increment
     */
    Mono<Long> incrementWithExpiry(String key, long delta, Duration ttl);

    /**
     * Current value, 0 when the key does not exist or has expired.
     */
    Mono<Long> get(String key);
}
