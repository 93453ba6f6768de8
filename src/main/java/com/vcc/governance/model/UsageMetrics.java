package com.vcc.governance.model;

import org.springframework.web.server.ServerWebExchange;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Side channel a handler fills in with consumption that is only known after it ran
 * (AI tokens, generated content, storage, bandwidth).
 * Thread-safe: a reactive handler may report from any scheduler.
 */
public final class UsageMetrics {

    public static final String EXCHANGE_ATTR = UsageMetrics.class.getName();

    private final Map<ResourceCategory, AtomicLong> quantities = new EnumMap<>(ResourceCategory.class);

    public UsageMetrics() {
        for (ResourceCategory category : ResourceCategory.values()) {
            quantities.put(category, new AtomicLong());
        }
    }

    /**
     * Metrics attached to the exchange by the governance filter, or a detached instance
     * when the request is not governed (reports are then discarded).
     */
    public static UsageMetrics current(ServerWebExchange exchange) {
        UsageMetrics metrics = exchange.getAttribute(EXCHANGE_ATTR);
        return metrics != null ? metrics : new UsageMetrics();
    }

    public UsageMetrics add(ResourceCategory category, long quantity) {
        if (quantity > 0) {
            quantities.get(category).addAndGet(quantity);
        }
        return this;
    }

    public UsageMetrics addAiTokens(long tokens) {
        return add(ResourceCategory.AI_TOKENS, tokens);
    }

    public UsageMetrics addContentGenerated(long units) {
        return add(ResourceCategory.CONTENT_GENERATION, units);
    }

    public UsageMetrics addStorageBytes(long bytes) {
        return add(ResourceCategory.STORAGE, bytes);
    }

    public UsageMetrics addBandwidthBytes(long bytes) {
        return add(ResourceCategory.BANDWIDTH, bytes);
    }

    public long get(ResourceCategory category) {
        return quantities.get(category).get();
    }
}
