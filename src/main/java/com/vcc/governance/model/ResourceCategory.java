package com.vcc.governance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Resource categories metered per tenant and billing period.
 */
public enum ResourceCategory {

    API_CALLS("api_calls", "requests"),
    AI_TOKENS("ai_tokens", "tokens"),
    CONTENT_GENERATION("content_generation", "generations"),
    STORAGE("storage", "bytes"),
    BANDWIDTH("bandwidth", "bytes");

    private final String key;
    private final String unit;

    ResourceCategory(String key, String unit) {
        this.key = key;
        this.unit = unit;
    }

    /**
     * Wire/storage name, e.g. {@code api_calls}.
     */
    @JsonValue
    public String key() {
        return key;
    }

    public String unit() {
        return unit;
    }

    /**
     * Lenient lookup accepting both {@code api_calls} and {@code API_CALLS} spellings.
     */
    public static ResourceCategory fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Resource category is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ResourceCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        // legacy plural spelling
        if ("content_generations".equals(normalized)) {
            return CONTENT_GENERATION;
        }
        throw new IllegalArgumentException("Unknown resource category: " + value);
    }
}
