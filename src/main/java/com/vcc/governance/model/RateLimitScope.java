package com.vcc.governance.model;

/**
 * Subject a rate-limit counter is keyed on.
 * Declaration order is the evaluation order.
 */
public enum RateLimitScope {
    TENANT,
    USER,
    GLOBAL
}
