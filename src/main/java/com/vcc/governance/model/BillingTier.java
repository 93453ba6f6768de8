package com.vcc.governance.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Named billing plan: its rate-limit rules and per-period quota ceilings.
 * A missing ceiling or a negative one means unlimited.
 */
public record BillingTier(
        String name,
        List<RateLimitRule> rules,
        Map<ResourceCategory, Long> quotas
) {

    public static final long UNLIMITED = -1L;

    public BillingTier {
        rules = rules != null ? List.copyOf(rules) : List.of();
        quotas = quotas != null && !quotas.isEmpty()
                ? Map.copyOf(new EnumMap<>(quotas))
                : Map.of();
    }

    public long quotaFor(ResourceCategory category) {
        Long limit = quotas.get(category);
        return limit != null && limit >= 0 ? limit : UNLIMITED;
    }

    public List<RateLimitRule> rulesFor(RateLimitScope scope) {
        return rules.stream()
                .filter(rule -> rule.scope() == scope)
                .toList();
    }
}
