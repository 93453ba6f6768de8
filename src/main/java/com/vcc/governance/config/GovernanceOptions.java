package com.vcc.governance.config;

import com.vcc.governance.model.BillingTier;
import com.vcc.governance.model.RateLimitRule;
import com.vcc.governance.model.RateLimitScope;
import com.vcc.governance.model.ResourceCategory;
import com.vcc.governance.model.WindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable governance configuration, built once at startup from {@link GovernanceProperties}.
 */
public record GovernanceOptions(
        boolean usageTracking,
        boolean rateLimiting,
        boolean quotaEnforcement,
        boolean tenantLimits,
        boolean globalLimits,
        Set<ResourceCategory> trackedCategories,
        String defaultBillingTier,
        Map<String, BillingTier> tiers,
        List<RateLimitRule> globalRules,
        List<Pattern> excludePatterns,
        String upgradeUrl,
        double softLimitThreshold,
        IdentityOptions identity,
        RecorderOptions recorder,
        String keyPrefix
) {
    private static final Logger log = LoggerFactory.getLogger(GovernanceOptions.class);

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "^/health.*",
            "^/ready.*",
            "^/actuator/health.*",
            "^/_next/.*",
            "^/static/.*",
            "^/favicon\\.ico$",
            ".*\\.(css|js|map|png|jpe?g|gif|svg|ico|woff2?)$",
            "^/debug.*"
    );

    public GovernanceOptions {
        trackedCategories = trackedCategories.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(trackedCategories));
        tiers = Map.copyOf(tiers);
        globalRules = List.copyOf(globalRules);
        excludePatterns = List.copyOf(excludePatterns);
        if (!tiers.containsKey(defaultBillingTier)) {
            throw new IllegalStateException("Default billing tier '" + defaultBillingTier + "' is not configured");
        }
    }

    /**
     * Tier by name, falling back to the default tier for unknown or missing names.
     */
    public BillingTier tier(String name) {
        BillingTier tier = name != null ? tiers.get(name) : null;
        return tier != null ? tier : tiers.get(defaultBillingTier);
    }

    public boolean hasTier(String name) {
        return name != null && tiers.containsKey(name);
    }

    public boolean isTracked(ResourceCategory category) {
        return trackedCategories.contains(category);
    }

    /**
     * The api_calls quota total only grows when recorded api calls are flushed.
     * Without it the pre-request quota check never denies.
     */
    public boolean apiCallTotalsMaintained() {
        return usageTracking && isTracked(ResourceCategory.API_CALLS);
    }

    /**
     * Identity signal options.
     */
    public record IdentityOptions(
            String jwtSecret,
            String tenantHeader,
            String userHeader,
            String tenantQueryParam,
            String userQueryParam,
            Set<String> reservedSubdomains,
            Map<String, ApiKeyIdentity> apiKeys,
            Map<String, String> tenantTiers
    ) {
        public IdentityOptions {
            reservedSubdomains = Set.copyOf(reservedSubdomains);
            apiKeys = Map.copyOf(apiKeys);
            tenantTiers = Map.copyOf(tenantTiers);
        }

        public boolean hasJwtSecret() {
            return jwtSecret != null && !jwtSecret.isBlank();
        }
    }

    public record ApiKeyIdentity(String tenantId, String userId, String tier) {
    }

    public record RecorderOptions(int queueCapacity, int batchSize, Duration flushInterval, Duration shutdownTimeout) {
    }

    // ==================== Conversion ====================

    public static GovernanceOptions from(GovernanceProperties properties) {
        Map<String, BillingTier> tiers = new LinkedHashMap<>();
        properties.getTiers().forEach((name, tierConfig) ->
                tiers.put(name, toTier(name, tierConfig)));
        // An unconfigured default tier is ungoverned rather than a startup failure
        tiers.computeIfAbsent(properties.getDefaultBillingTier(),
                name -> new BillingTier(name, List.of(), Map.of()));

        List<RateLimitRule> globalRules = new ArrayList<>();
        List<GovernanceProperties.RuleConfig> globalConfigs = properties.getGlobalRules();
        for (int i = 0; i < globalConfigs.size(); i++) {
            RateLimitRule rule = toRule("global", i, globalConfigs.get(i));
            if (rule.scope() != RateLimitScope.GLOBAL) {
                throw new IllegalStateException("Rule " + rule.id() + " under global-rules must have scope 'global'");
            }
            globalRules.add(rule);
        }

        List<String> patternSources = properties.getExcludePatterns() == null || properties.getExcludePatterns().isEmpty()
                ? DEFAULT_EXCLUDE_PATTERNS
                : properties.getExcludePatterns();

        GovernanceOptions options = new GovernanceOptions(
                properties.isEnableUsageTracking(),
                properties.isEnableRateLimiting(),
                properties.isEnableQuotaEnforcement(),
                properties.isEnableTenantLimits(),
                properties.isEnableGlobalLimits(),
                trackedCategories(properties.getTracking()),
                properties.getDefaultBillingTier(),
                tiers,
                globalRules,
                patternSources.stream().map(GovernanceOptions::compile).toList(),
                properties.getUpgradeUrl(),
                properties.getSoftLimitThreshold(),
                toIdentity(properties.getIdentity()),
                toRecorder(properties.getRecorder()),
                properties.getStore().getKeyPrefix() != null ? properties.getStore().getKeyPrefix() : "gov:"
        );
        if (options.quotaEnforcement() && !options.apiCallTotalsMaintained()) {
            log.warn("Quota enforcement is enabled but api_calls usage is not tracked; "
                    + "api_calls totals will not grow and requests will never be denied with 402");
        }
        return options;
    }

    private static Set<ResourceCategory> trackedCategories(GovernanceProperties.TrackingConfig tracking) {
        Set<ResourceCategory> tracked = EnumSet.noneOf(ResourceCategory.class);
        if (tracking.isTrackApiCalls()) {
            tracked.add(ResourceCategory.API_CALLS);
        }
        if (tracking.isTrackAiTokens()) {
            tracked.add(ResourceCategory.AI_TOKENS);
        }
        if (tracking.isTrackContentGeneration()) {
            tracked.add(ResourceCategory.CONTENT_GENERATION);
        }
        if (tracking.isTrackStorage()) {
            tracked.add(ResourceCategory.STORAGE);
        }
        if (tracking.isTrackBandwidth()) {
            tracked.add(ResourceCategory.BANDWIDTH);
        }
        return tracked;
    }

    private static BillingTier toTier(String name, GovernanceProperties.TierConfig config) {
        List<RateLimitRule> rules = new ArrayList<>();
        for (int i = 0; i < config.getRateLimits().size(); i++) {
            RateLimitRule rule = toRule(name, i, config.getRateLimits().get(i));
            if (rule.scope() == RateLimitScope.GLOBAL) {
                throw new IllegalStateException("Rule " + rule.id() + ": global rules belong under governance.global-rules");
            }
            rules.add(rule);
        }
        Map<ResourceCategory, Long> quotas = new EnumMap<>(ResourceCategory.class);
        config.getQuotas().forEach((category, limit) ->
                quotas.put(ResourceCategory.fromKey(category), limit));
        return new BillingTier(name, rules, quotas);
    }

    private static RateLimitRule toRule(String owner, int index, GovernanceProperties.RuleConfig config) {
        RateLimitScope scope = RateLimitScope.valueOf(config.getScope().trim().toUpperCase(Locale.ROOT));
        String id = config.getId() != null && !config.getId().isBlank()
                ? config.getId()
                : owner + "-" + scope.name().toLowerCase(Locale.ROOT) + "-" + index;
        WindowType type = config.getType() != null
                ? WindowType.valueOf(config.getType().trim().toUpperCase(Locale.ROOT))
                : WindowType.FIXED;
        Pattern endpoint = config.getEndpointPattern() != null && !config.getEndpointPattern().isBlank()
                ? compile(config.getEndpointPattern())
                : null;
        Set<String> methods = config.getMethods() == null ? Set.of() : Set.copyOf(
                config.getMethods().stream().map(m -> m.trim().toUpperCase(Locale.ROOT)).toList());
        return new RateLimitRule(id, scope, config.getWindow(), config.getMaxRequests(), type,
                config.getMessage(), endpoint, methods);
    }

    private static IdentityOptions toIdentity(GovernanceProperties.IdentityConfig config) {
        Map<String, ApiKeyIdentity> apiKeys = new LinkedHashMap<>();
        for (GovernanceProperties.ApiKeyConfig key : config.getApiKeys()) {
            apiKeys.put(key.getApiKey(), new ApiKeyIdentity(key.getTenantId(), key.getUserId(), key.getTier()));
        }
        Set<String> reserved = new HashSet<>();
        for (String sub : config.getReservedSubdomains()) {
            reserved.add(sub.toLowerCase(Locale.ROOT));
        }
        return new IdentityOptions(
                config.getJwtSecret(),
                config.getTenantHeader(),
                config.getUserHeader(),
                config.getTenantQueryParam(),
                config.getUserQueryParam(),
                reserved,
                apiKeys,
                config.getTenantTiers()
        );
    }

    private static RecorderOptions toRecorder(GovernanceProperties.RecorderConfig config) {
        return new RecorderOptions(
                config.getQueueCapacity(),
                config.getBatchSize(),
                config.getFlushInterval(),
                config.getShutdownTimeout()
        );
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("Invalid pattern in governance configuration: " + regex, e);
        }
    }
}
