package com.vcc.governance.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable rate-limit rule, loaded from configuration at startup.
 */
public record RateLimitRule(
        String id,
        RateLimitScope scope,
        Duration window,
        long maxRequests,
        WindowType windowType,
        String message,         // Custom denial message (optional)
        Pattern endpointPattern, // Restricts the rule to matching paths (optional)
        Set<String> methods      // Restricts the rule to these HTTP methods (empty = all)
) {

    public RateLimitRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rule " + id + ": window must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("Rule " + id + ": maxRequests must be positive");
        }
        windowType = windowType != null ? windowType : WindowType.FIXED;
        methods = methods != null ? Set.copyOf(methods) : Set.of();
    }

    /**
     * Convenience factory for an unrestricted fixed-window rule.
     */
    public static RateLimitRule fixed(String id, RateLimitScope scope, Duration window, long maxRequests) {
        return new RateLimitRule(id, scope, window, maxRequests, WindowType.FIXED, null, null, Set.of());
    }

    /**
     * Check whether this rule governs a request to the given endpoint.
     * The endpoint pattern is searched for in the path, not matched against all of it.
     */
    public boolean appliesTo(String path, String method) {
        if (!methods.isEmpty() && (method == null || !methods.contains(method.toUpperCase(Locale.ROOT)))) {
            return false;
        }
        return endpointPattern == null || (path != null && endpointPattern.matcher(path).find());
    }

    public long windowMillis() {
        return window.toMillis();
    }
}
