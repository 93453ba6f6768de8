package com.vcc.governance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Raw binding of the {@code governance.*} configuration tree.
 * Converted once at startup into {@link GovernanceOptions}; nothing reads this at request time.
 */
@ConfigurationProperties(prefix = "governance")
@Validated
public class GovernanceProperties {

    private boolean enableUsageTracking = true;

    private boolean enableRateLimiting = true;

    // The api_calls pre-check reads totals fed by usage tracking; needs enable-usage-tracking and tracking.track-api-calls
    private boolean enableQuotaEnforcement = true;

    // Rate-limit scopes: tenant (and user) rules vs. global rules
    private boolean enableTenantLimits = true;

    private boolean enableGlobalLimits = true;

    @NotBlank
    private String defaultBillingTier = "free";

    // Empty = built-in defaults (health, static assets, debug)
    private List<String> excludePatterns = new ArrayList<>();

    @NotBlank
    private String upgradeUrl = "/pricing";

    // Percent of a quota at which consumption is logged as approaching the limit
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double softLimitThreshold = 80.0;

    @Valid
    private TrackingConfig tracking = new TrackingConfig();

    @Valid
    private Map<String, TierConfig> tiers = new LinkedHashMap<>();

    @Valid
    private List<RuleConfig> globalRules = new ArrayList<>();

    @Valid
    private IdentityConfig identity = new IdentityConfig();

    @Valid
    private RecorderConfig recorder = new RecorderConfig();

    @Valid
    private StoreConfig store = new StoreConfig();

    // ==================== Getters/Setters ====================

    public boolean isEnableUsageTracking() {
        return enableUsageTracking;
    }

    public void setEnableUsageTracking(boolean enableUsageTracking) {
        this.enableUsageTracking = enableUsageTracking;
    }

    public boolean isEnableRateLimiting() {
        return enableRateLimiting;
    }

    public void setEnableRateLimiting(boolean enableRateLimiting) {
        this.enableRateLimiting = enableRateLimiting;
    }

    public boolean isEnableQuotaEnforcement() {
        return enableQuotaEnforcement;
    }

    public void setEnableQuotaEnforcement(boolean enableQuotaEnforcement) {
        this.enableQuotaEnforcement = enableQuotaEnforcement;
    }

    public boolean isEnableTenantLimits() {
        return enableTenantLimits;
    }

    public void setEnableTenantLimits(boolean enableTenantLimits) {
        this.enableTenantLimits = enableTenantLimits;
    }

    public boolean isEnableGlobalLimits() {
        return enableGlobalLimits;
    }

    public void setEnableGlobalLimits(boolean enableGlobalLimits) {
        this.enableGlobalLimits = enableGlobalLimits;
    }

    public String getDefaultBillingTier() {
        return defaultBillingTier;
    }

    public void setDefaultBillingTier(String defaultBillingTier) {
        this.defaultBillingTier = defaultBillingTier;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns;
    }

    public String getUpgradeUrl() {
        return upgradeUrl;
    }

    public void setUpgradeUrl(String upgradeUrl) {
        this.upgradeUrl = upgradeUrl;
    }

    public double getSoftLimitThreshold() {
        return softLimitThreshold;
    }

    public void setSoftLimitThreshold(double softLimitThreshold) {
        this.softLimitThreshold = softLimitThreshold;
    }

    public TrackingConfig getTracking() {
        return tracking;
    }

    public void setTracking(TrackingConfig tracking) {
        this.tracking = tracking;
    }

    public Map<String, TierConfig> getTiers() {
        return tiers;
    }

    public void setTiers(Map<String, TierConfig> tiers) {
        this.tiers = tiers;
    }

    public List<RuleConfig> getGlobalRules() {
        return globalRules;
    }

    public void setGlobalRules(List<RuleConfig> globalRules) {
        this.globalRules = globalRules;
    }

    public IdentityConfig getIdentity() {
        return identity;
    }

    public void setIdentity(IdentityConfig identity) {
        this.identity = identity;
    }

    public RecorderConfig getRecorder() {
        return recorder;
    }

    public void setRecorder(RecorderConfig recorder) {
        this.recorder = recorder;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Per-category usage tracking toggles.
     */
    public static class TrackingConfig {
        private boolean trackApiCalls = true;
        private boolean trackAiTokens = true;
        private boolean trackContentGeneration = true;
        private boolean trackStorage = true;
        private boolean trackBandwidth = true;

        public boolean isTrackApiCalls() {
            return trackApiCalls;
        }

        public void setTrackApiCalls(boolean trackApiCalls) {
            this.trackApiCalls = trackApiCalls;
        }

        public boolean isTrackAiTokens() {
            return trackAiTokens;
        }

        public void setTrackAiTokens(boolean trackAiTokens) {
            this.trackAiTokens = trackAiTokens;
        }

        public boolean isTrackContentGeneration() {
            return trackContentGeneration;
        }

        public void setTrackContentGeneration(boolean trackContentGeneration) {
            this.trackContentGeneration = trackContentGeneration;
        }

        public boolean isTrackStorage() {
            return trackStorage;
        }

        public void setTrackStorage(boolean trackStorage) {
            this.trackStorage = trackStorage;
        }

        public boolean isTrackBandwidth() {
            return trackBandwidth;
        }

        public void setTrackBandwidth(boolean trackBandwidth) {
            this.trackBandwidth = trackBandwidth;
        }
    }

    /**
     * Billing tier: its rate-limit rules and per-period quota ceilings.
     */
    public static class TierConfig {
        @Valid
        private List<RuleConfig> rateLimits = new ArrayList<>();

        // Keyed by category name (api_calls, ai_tokens, ...); -1 = unlimited
        private Map<String, Long> quotas = new LinkedHashMap<>();

        public List<RuleConfig> getRateLimits() {
            return rateLimits;
        }

        public void setRateLimits(List<RuleConfig> rateLimits) {
            this.rateLimits = rateLimits;
        }

        public Map<String, Long> getQuotas() {
            return quotas;
        }

        public void setQuotas(Map<String, Long> quotas) {
            this.quotas = quotas;
        }
    }

    /**
     * A single rate-limit rule.
     */
    public static class RuleConfig {
        // Derived from scope and position when blank
        private String id;

        @NotBlank
        private String scope = "tenant";

        @NotNull
        private Duration window = Duration.ofMinutes(1);

        @Min(1)
        private long maxRequests = 60;

        // fixed | sliding
        private String type = "fixed";

        private String message;

        // Regex; rule applies to every path when blank
        private String endpointPattern;

        private List<String> methods = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getScope() {
            return scope;
        }

        public void setScope(String scope) {
            this.scope = scope;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public long getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(long maxRequests) {
            this.maxRequests = maxRequests;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getEndpointPattern() {
            return endpointPattern;
        }

        public void setEndpointPattern(String endpointPattern) {
            this.endpointPattern = endpointPattern;
        }

        public List<String> getMethods() {
            return methods;
        }

        public void setMethods(List<String> methods) {
            this.methods = methods;
        }
    }

    /**
     * Identity signal configuration.
     */
    public static class IdentityConfig {
        // HS256 secret for bearer tokens; token credentials are ignored when blank
        private String jwtSecret;

        private String tenantHeader = "x-tenant-id";
        private String userHeader = "x-user-id";
        private String tenantQueryParam = "tenant_id";
        private String userQueryParam = "user_id";

        private List<String> reservedSubdomains = new ArrayList<>(List.of("www", "api"));

        // Static API keys (YAML tenants)
        @Valid
        private List<ApiKeyConfig> apiKeys = new ArrayList<>();

        // tenantId -> billing tier for tenants whose credential carries no tier
        private Map<String, String> tenantTiers = new LinkedHashMap<>();

        public String getJwtSecret() {
            return jwtSecret;
        }

        public void setJwtSecret(String jwtSecret) {
            this.jwtSecret = jwtSecret;
        }

        public String getTenantHeader() {
            return tenantHeader;
        }

        public void setTenantHeader(String tenantHeader) {
            this.tenantHeader = tenantHeader;
        }

        public String getUserHeader() {
            return userHeader;
        }

        public void setUserHeader(String userHeader) {
            this.userHeader = userHeader;
        }

        public String getTenantQueryParam() {
            return tenantQueryParam;
        }

        public void setTenantQueryParam(String tenantQueryParam) {
            this.tenantQueryParam = tenantQueryParam;
        }

        public String getUserQueryParam() {
            return userQueryParam;
        }

        public void setUserQueryParam(String userQueryParam) {
            this.userQueryParam = userQueryParam;
        }

        public List<String> getReservedSubdomains() {
            return reservedSubdomains;
        }

        public void setReservedSubdomains(List<String> reservedSubdomains) {
            this.reservedSubdomains = reservedSubdomains;
        }

        public List<ApiKeyConfig> getApiKeys() {
            return apiKeys;
        }

        public void setApiKeys(List<ApiKeyConfig> apiKeys) {
            this.apiKeys = apiKeys;
        }

        public Map<String, String> getTenantTiers() {
            return tenantTiers;
        }

        public void setTenantTiers(Map<String, String> tenantTiers) {
            this.tenantTiers = tenantTiers;
        }
    }

    /**
     * Static API key mapped to a tenant.
     */
    public static class ApiKeyConfig {
        @NotBlank
        private String apiKey;

        @NotBlank
        private String tenantId;

        private String userId;

        private String tier;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getTier() {
            return tier;
        }

        public void setTier(String tier) {
            this.tier = tier;
        }
    }

    /**
     * Usage recorder queue and batching.
     */
    public static class RecorderConfig {
        @Min(1)
        private int queueCapacity = 10_000;

        @Min(1)
        private int batchSize = 100;

        @NotNull
        private Duration flushInterval = Duration.ofSeconds(5);

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Counter/quota store configuration.
     */
    public static class StoreConfig {
        // Redis key prefix
        private String keyPrefix = "gov:";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }
}
