package com.vcc.governance.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of evaluating the rate-limit rules for one request.
 * When {@code ruleId} is null no rule was evaluated and no headers should be emitted.
 */
public record RateLimitDecision(
        boolean allowed,
        String ruleId,
        long maxRequests,
        long currentCount,
        Instant windowEnd,
        long retryAfterSeconds,
        String message
) {

    private static final RateLimitDecision UNRESTRICTED =
            new RateLimitDecision(true, null, 0, 0, null, 0, null);

    /**
     * No rule applied (or the store was unreachable).
     */
    public static RateLimitDecision unrestricted() {
        return UNRESTRICTED;
    }

    public static RateLimitDecision allowed(RateLimitRule rule, long count, Instant windowEnd) {
        return new RateLimitDecision(true, rule.id(), rule.maxRequests(), count, windowEnd, 0, null);
    }

    public static RateLimitDecision denied(RateLimitRule rule, long count, Instant windowEnd, Instant now) {
        long millis = Duration.between(now, windowEnd).toMillis();
        // round up so clients never retry inside the window
        long retryAfter = Math.max(1, (millis + 999) / 1000);
        String message = rule.message() != null
                ? rule.message()
                : "Rate limit exceeded: " + rule.maxRequests() + " requests per " + rule.window().toSeconds() + "s";
        return new RateLimitDecision(false, rule.id(), rule.maxRequests(), count, windowEnd, retryAfter, message);
    }

    public boolean hasRule() {
        return ruleId != null;
    }

    public long remaining() {
        return Math.max(0, maxRequests - currentCount);
    }

    /**
     * Window reset as epoch seconds, for {@code X-RateLimit-Reset}.
     */
    public long resetEpochSeconds() {
        return windowEnd != null ? windowEnd.getEpochSecond() : 0;
    }
}
