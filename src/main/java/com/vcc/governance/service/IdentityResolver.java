package com.vcc.governance.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.crypto.BearerTokenVerifier;
import com.vcc.governance.model.ResolvedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves tenant, user and billing tier from already-authenticated request signals.
 *
 * Resolution order, first match wins independently for tenant and user:
 * 1. Credential: static API key or HS256 bearer token claims
 * 2. Explicit header (x-tenant-id / x-user-id)
 * 3. Query parameter (tenant_id / user_id)
 * 4. Subdomain slug (tenant only, reserved subdomains excluded)
 *
 * Tier: credential claim, then the configured tenant tier table, then the default tier.
 * Never throws; unusable signals are treated as absent.
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final GovernanceOptions options;
    private final GovernanceOptions.IdentityOptions identity;
    private final BearerTokenVerifier tokenVerifier;  // null when no secret configured

    public IdentityResolver(GovernanceOptions options, ObjectMapper objectMapper, Clock clock) {
        this.options = options;
        this.identity = options.identity();
        this.tokenVerifier = identity.hasJwtSecret()
                ? new BearerTokenVerifier(identity.jwtSecret(), objectMapper, clock)
                : null;
        log.info("IdentityResolver initialized: apiKeys={}, bearerTokens={}, reservedSubdomains={}",
                identity.apiKeys().size(), tokenVerifier != null, identity.reservedSubdomains());
    }

    public ResolvedIdentity resolve(ServerHttpRequest request) {
        try {
            return doResolve(request);
        } catch (RuntimeException e) {
            log.warn("Identity resolution failed, treating request as unresolved: {}", e.getMessage());
            return new ResolvedIdentity(null, null, options.defaultBillingTier());
        }
    }

    private ResolvedIdentity doResolve(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        Credential credential = resolveCredential(headers.getFirst(HttpHeaders.AUTHORIZATION))
                .orElse(Credential.NONE);

        String tenantId = firstNonBlank(
                credential.tenantId(),
                headers.getFirst(identity.tenantHeader()),
                request.getQueryParams().getFirst(identity.tenantQueryParam()),
                subdomainTenant(request));

        String userId = firstNonBlank(
                credential.userId(),
                headers.getFirst(identity.userHeader()),
                request.getQueryParams().getFirst(identity.userQueryParam()));

        String tier = resolveTier(credential.tier(), tenantId);
        log.debug("Resolved identity tenant={} user={} tier={}", tenantId, userId, tier);
        return new ResolvedIdentity(tenantId, userId, tier);
    }

    /**
     * Credential signal: configured API key first, then a verified bearer token.
     */
    private Optional<Credential> resolveCredential(String authorizationHeader) {
        Optional<String> token = BearerTokenVerifier.extractBearer(authorizationHeader);
        if (token.isEmpty()) {
            return Optional.empty();
        }

        GovernanceOptions.ApiKeyIdentity apiKey = identity.apiKeys().get(token.get());
        if (apiKey != null) {
            log.debug("Resolved credential from API key {}", BearerTokenVerifier.mask(token.get()));
            return Optional.of(new Credential(apiKey.tenantId(), apiKey.userId(), apiKey.tier()));
        }

        if (tokenVerifier == null) {
            return Optional.empty();
        }
        return tokenVerifier.verify(token.get())
                .map(claims -> new Credential(
                        claim(claims, "tenant_id", "tenantId"),
                        claim(claims, "user_id", "sub"),
                        claim(claims, "billing_tier", "tier")));
    }

    private String resolveTier(String credentialTier, String tenantId) {
        if (options.hasTier(credentialTier)) {
            return credentialTier;
        }
        if (credentialTier != null) {
            log.debug("Ignoring unknown billing tier '{}' from credential", credentialTier);
        }
        if (tenantId != null) {
            String configured = identity.tenantTiers().get(tenantId);
            if (options.hasTier(configured)) {
                return configured;
            }
        }
        return options.defaultBillingTier();
    }

    /**
     * Tenant slug from {@code slug.example.com}; needs at least three labels.
     */
    String subdomainTenant(ServerHttpRequest request) {
        String host = null;
        InetSocketAddress hostHeader = request.getHeaders().getHost();
        if (hostHeader != null) {
            host = hostHeader.getHostString();
        } else if (request.getURI().getHost() != null) {
            host = request.getURI().getHost();
        }
        if (host == null || host.isBlank() || Character.isDigit(host.charAt(host.length() - 1))) {
            // absent, or an IPv4 literal
            return null;
        }
        String[] labels = host.toLowerCase(Locale.ROOT).split("\\.");
        if (labels.length < 3 || labels[0].isBlank()) {
            return null;
        }
        return identity.reservedSubdomains().contains(labels[0]) ? null : labels[0];
    }

    private static String claim(JsonNode claims, String name, String fallbackName) {
        JsonNode value = claims.get(name);
        if (value == null || !value.isTextual()) {
            value = claims.get(fallbackName);
        }
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }

    private record Credential(String tenantId, String userId, String tier) {
        static final Credential NONE = new Credential(null, null, null);
    }
}
