package com.vcc.governance.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.dto.QuotaExceededResponse;
import com.vcc.governance.dto.RateLimitExceededResponse;
import com.vcc.governance.model.GovernanceState;
import com.vcc.governance.model.QuotaDecision;
import com.vcc.governance.model.RateLimitDecision;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.model.ResolvedIdentity;
import com.vcc.governance.model.UsageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebHandler;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single entry/exit point of request governance.
 *
 * RESOLVING_IDENTITY -> CHECKING_EXCLUSION -> (PASSTHROUGH) -> RATE_LIMITING -> (DENIED_429)
 * -> QUOTA_CHECKING -> (DENIED_402) -> HANDLING -> RECORDING -> DONE
 *
 * Denied requests never reach the handler and are never recorded. Every handled request is
 * recorded exactly once, including handler errors and cancellations. Governance failures
 * degrade to letting the request through.
 */
public class GovernanceOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(GovernanceOrchestrator.class);

    public static final String STATE_ATTR = "governance.state";
    public static final String CONTEXT_ATTR = RequestContext.class.getName();

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";

    // nginx convention for a client that went away before the response
    static final int CLIENT_CLOSED_REQUEST = 499;

    private final GovernanceOptions options;
    private final IdentityResolver identityResolver;
    private final ExclusionFilter exclusionFilter;
    private final RateLimiter rateLimiter;
    private final QuotaEnforcer quotaEnforcer;
    private final UsageRecorder usageRecorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GovernanceOrchestrator(GovernanceOptions options,
                                  IdentityResolver identityResolver,
                                  ExclusionFilter exclusionFilter,
                                  RateLimiter rateLimiter,
                                  QuotaEnforcer quotaEnforcer,
                                  UsageRecorder usageRecorder,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.options = options;
        this.identityResolver = identityResolver;
        this.exclusionFilter = exclusionFilter;
        this.rateLimiter = rateLimiter;
        this.quotaEnforcer = quotaEnforcer;
        this.usageRecorder = usageRecorder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Wrap a handler so every invocation is governed.
     */
    public WebHandler wrap(WebHandler handler) {
        return exchange -> handle(exchange, handler);
    }

    public Mono<Void> handle(ServerWebExchange exchange, WebHandler handler) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();

        RequestContext ctx;
        boolean excluded;
        try {
            transition(exchange, GovernanceState.RESOLVING_IDENTITY);
            ResolvedIdentity identity = identityResolver.resolve(request);
            ctx = new RequestContext(
                    identity.tenantId(),
                    identity.userId(),
                    identity.billingTier(),
                    path,
                    request.getMethod().name(),
                    clock.instant());

            transition(exchange, GovernanceState.CHECKING_EXCLUSION);
            excluded = exclusionFilter.isExcluded(path);
        } catch (RuntimeException e) {
            log.warn("Governance setup failed for {}, passing request through: {}", path, e.getMessage());
            return passThrough(exchange, handler);
        }
        if (excluded) {
            return passThrough(exchange, handler);
        }

        UsageMetrics metrics = new UsageMetrics();
        exchange.getAttributes().put(CONTEXT_ATTR, ctx);
        exchange.getAttributes().put(UsageMetrics.EXCHANGE_ATTR, metrics);

        transition(exchange, GovernanceState.RATE_LIMITING);
        return rateLimiter.evaluate(ctx)
                .onErrorResume(e -> {
                    log.warn("Rate limiter failed for {}, failing open: {}", ctx, e.getMessage());
                    return Mono.just(RateLimitDecision.unrestricted());
                })
                .defaultIfEmpty(RateLimitDecision.unrestricted())
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        transition(exchange, GovernanceState.DENIED_429);
                        return rejectRateLimited(exchange, decision);
                    }
                    applyRateLimitHeaders(exchange.getResponse().getHeaders(), decision);
                    return checkQuotaAndHandle(exchange, handler, ctx, metrics);
                });
    }

    private Mono<Void> checkQuotaAndHandle(ServerWebExchange exchange, WebHandler handler,
                                           RequestContext ctx, UsageMetrics metrics) {
        transition(exchange, GovernanceState.QUOTA_CHECKING);
        return quotaEnforcer.checkBeforeRequest(ctx)
                .onErrorResume(e -> {
                    log.warn("Quota enforcer failed for {}, failing open: {}", ctx, e.getMessage());
                    return Mono.just(QuotaDecision.skipped());
                })
                .defaultIfEmpty(QuotaDecision.skipped())
                .flatMap(quota -> {
                    if (!quota.allowed()) {
                        transition(exchange, GovernanceState.DENIED_402);
                        return rejectQuotaExceeded(exchange, quota);
                    }
                    return handleAndRecord(exchange, handler, ctx, metrics);
                });
    }

    private Mono<Void> handleAndRecord(ServerWebExchange exchange, WebHandler handler,
                                       RequestContext ctx, UsageMetrics metrics) {
        transition(exchange, GovernanceState.HANDLING);
        AtomicBoolean recorded = new AtomicBoolean(false);
        AtomicReference<Integer> errorStatus = new AtomicReference<>();

        return Mono.defer(() -> handler.handle(exchange))
                .doOnError(e -> errorStatus.set(statusOf(e)))
                .doFinally(signal -> {
                    if (!recorded.compareAndSet(false, true)) {
                        return;
                    }
                    transition(exchange, GovernanceState.RECORDING);
                    int status;
                    if (errorStatus.get() != null) {
                        status = errorStatus.get();
                    } else if (signal == SignalType.CANCEL) {
                        status = responseStatus(exchange.getResponse(), CLIENT_CLOSED_REQUEST);
                    } else {
                        status = responseStatus(exchange.getResponse(), HttpStatus.OK.value());
                    }
                    usageRecorder.record(ctx, status, metrics);
                    transition(exchange, GovernanceState.DONE);
                });
    }

    private Mono<Void> passThrough(ServerWebExchange exchange, WebHandler handler) {
        transition(exchange, GovernanceState.PASSTHROUGH);
        return Mono.defer(() -> handler.handle(exchange))
                .doFinally(signal -> transition(exchange, GovernanceState.DONE));
    }

    // ==================== Responses ====================

    private Mono<Void> rejectRateLimited(ServerWebExchange exchange, RateLimitDecision decision) {
        log.debug("Rejecting {} {} with 429 (rule={})",
                exchange.getRequest().getMethod(), exchange.getRequest().getPath(), decision.ruleId());
        ServerHttpResponse response = exchange.getResponse();
        applyRateLimitHeaders(response.getHeaders(), decision);
        response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        return writeJson(response, HttpStatus.TOO_MANY_REQUESTS, RateLimitExceededResponse.from(decision));
    }

    private Mono<Void> rejectQuotaExceeded(ServerWebExchange exchange, QuotaDecision decision) {
        log.debug("Rejecting {} {} with 402: {}",
                exchange.getRequest().getMethod(), exchange.getRequest().getPath(), decision.reason());
        return writeJson(exchange.getResponse(), HttpStatus.PAYMENT_REQUIRED,
                QuotaExceededResponse.from(decision, options.upgradeUrl()));
    }

    private Mono<Void> writeJson(ServerHttpResponse response, HttpStatus status, Object body) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize governance response", e));
        }
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }

    static void applyRateLimitHeaders(HttpHeaders headers, RateLimitDecision decision) {
        if (!decision.hasRule()) {
            return;
        }
        headers.set(HEADER_LIMIT, String.valueOf(decision.maxRequests()));
        headers.set(HEADER_REMAINING, String.valueOf(decision.remaining()));
        headers.set(HEADER_RESET, String.valueOf(decision.resetEpochSeconds()));
    }

    // ==================== Helpers ====================

    private static int statusOf(Throwable error) {
        if (error instanceof ResponseStatusException rse) {
            return rse.getStatusCode().value();
        }
        return HttpStatus.INTERNAL_SERVER_ERROR.value();
    }

    private static int responseStatus(ServerHttpResponse response, int fallback) {
        HttpStatusCode status = response.getStatusCode();
        return status != null ? status.value() : fallback;
    }

    private static void transition(ServerWebExchange exchange, GovernanceState state) {
        GovernanceState previous = exchange.getAttribute(STATE_ATTR);
        if (previous != null && previous.isTerminal()) {
            return;
        }
        exchange.getAttributes().put(STATE_ATTR, state);
        if (log.isTraceEnabled()) {
            log.trace("{} {}: {} -> {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    previous, state);
        }
    }

    /**
     * Context of a governed request, or null when the request was excluded.
     */
    public static RequestContext contextOf(ServerWebExchange exchange) {
        return exchange.getAttribute(CONTEXT_ATTR);
    }
}
