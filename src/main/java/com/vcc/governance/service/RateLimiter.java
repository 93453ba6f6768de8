package com.vcc.governance.service;

import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.model.BillingTier;
import com.vcc.governance.model.RateLimitDecision;
import com.vcc.governance.model.RateLimitRule;
import com.vcc.governance.model.RateLimitScope;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.model.WindowType;
import com.vcc.governance.store.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Window-counter rate limiter over an external atomic counter store.
 *
 * Rules are evaluated in a fixed order (tenant, user, global; config order within a scope)
 * and evaluation stops at the first denial. Every evaluated rule consumes one unit of its
 * window, so an admitted request stays counted even if the handler later fails.
 * A store failure skips the affected rule (fail open).
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final String GLOBAL_SUBJECT = "all";

    private final GovernanceOptions options;
    private final CounterStore counterStore;
    private final Clock clock;
    private final String keyPrefix;

    public RateLimiter(GovernanceOptions options, CounterStore counterStore, Clock clock) {
        this.options = options;
        this.counterStore = counterStore;
        this.clock = clock;
        this.keyPrefix = options.keyPrefix() + "rl:";
        log.info("RateLimiter initialized: enabled={}, tenantLimits={}, globalLimits={}, globalRules={}",
                options.rateLimiting(), options.tenantLimits(), options.globalLimits(), options.globalRules().size());
    }

    /**
     * Evaluate every rule applicable to the request.
     *
     * @return the first denial, or the most restrictive allowed result;
     *         {@link RateLimitDecision#unrestricted()} when no rule applied
     */
    public Mono<RateLimitDecision> evaluate(RequestContext ctx) {
        if (!options.rateLimiting()) {
            return Mono.just(RateLimitDecision.unrestricted());
        }
        List<ScopedRule> rules = applicableRules(ctx);
        if (rules.isEmpty()) {
            return Mono.just(RateLimitDecision.unrestricted());
        }

        Instant now = clock.instant();
        return Flux.fromIterable(rules)
                .concatMap(scoped -> check(scoped, now)
                        .onErrorResume(e -> {
                            log.warn("Rate limit store unavailable for rule {} ({}), failing open: {}",
                                    scoped.rule().id(), scoped.subject(), e.getMessage());
                            return Mono.empty();
                        }))
                .takeUntil(decision -> !decision.allowed())
                .collectList()
                .map(RateLimiter::summarize)
                .doOnNext(decision -> {
                    if (!decision.allowed()) {
                        log.debug("Rate limit exceeded for {} (rule={}, count={}, max={})",
                                ctx, decision.ruleId(), decision.currentCount(), decision.maxRequests());
                    }
                });
    }

    /**
     * Rules for this request in evaluation order, paired with the subject they count against.
     */
    List<ScopedRule> applicableRules(RequestContext ctx) {
        List<ScopedRule> rules = new ArrayList<>();
        if (options.tenantLimits() && ctx.hasTenant()) {
            BillingTier tier = options.tier(ctx.billingTier());
            for (RateLimitRule rule : tier.rulesFor(RateLimitScope.TENANT)) {
                rules.add(new ScopedRule(rule, ctx.tenantId()));
            }
            if (ctx.hasUser()) {
                for (RateLimitRule rule : tier.rulesFor(RateLimitScope.USER)) {
                    rules.add(new ScopedRule(rule, ctx.tenantId() + ":" + ctx.userId()));
                }
            }
        }
        if (options.globalLimits()) {
            for (RateLimitRule rule : options.globalRules()) {
                rules.add(new ScopedRule(rule, GLOBAL_SUBJECT));
            }
        }
        rules.removeIf(scoped -> !scoped.rule().appliesTo(ctx.endpoint(), ctx.method()));
        return rules;
    }

    private Mono<RateLimitDecision> check(ScopedRule scoped, Instant now) {
        RateLimitRule rule = scoped.rule();
        long windowMillis = rule.windowMillis();
        long nowMillis = now.toEpochMilli();
        long windowIndex = Math.floorDiv(nowMillis, windowMillis);
        long windowStart = windowIndex * windowMillis;
        Instant windowEnd = Instant.ofEpochMilli(windowStart + windowMillis);

        Mono<Long> current = counterStore.incrementWithExpiry(
                key(scoped, windowIndex), 1, rule.window().multipliedBy(2));

        Mono<Long> effectiveCount;
        if (rule.windowType() == WindowType.SLIDING) {
            double previousWeight = 1.0d - (double) (nowMillis - windowStart) / windowMillis;
            effectiveCount = current.zipWith(counterStore.get(key(scoped, windowIndex - 1)),
                    (count, previous) -> count + (long) Math.floor(previous * previousWeight));
        } else {
            effectiveCount = current;
        }

        return effectiveCount.map(count -> count <= rule.maxRequests()
                ? RateLimitDecision.allowed(rule, count, windowEnd)
                : RateLimitDecision.denied(rule, count, windowEnd, now));
    }

    private String key(ScopedRule scoped, long windowIndex) {
        return keyPrefix + scoped.rule().scope().name().toLowerCase(Locale.ROOT) + ":"
                + scoped.subject() + ":" + scoped.rule().id() + ":" + windowIndex;
    }

    /**
     * The last decision is the denial if there was one; otherwise report the rule
     * closest to its limit.
     */
    private static RateLimitDecision summarize(List<RateLimitDecision> decisions) {
        if (decisions.isEmpty()) {
            return RateLimitDecision.unrestricted();
        }
        RateLimitDecision last = decisions.get(decisions.size() - 1);
        if (!last.allowed()) {
            return last;
        }
        return decisions.stream()
                .min(Comparator.comparingLong(RateLimitDecision::remaining))
                .orElse(last);
    }

    record ScopedRule(RateLimitRule rule, String subject) {
    }
}
