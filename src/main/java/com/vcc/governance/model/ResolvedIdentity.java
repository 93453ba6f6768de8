package com.vcc.governance.model;

/**
 * Output of identity resolution. Any field may be null except the tier.
 */
public record ResolvedIdentity(String tenantId, String userId, String billingTier) {

    public boolean hasTenant() {
        return tenantId != null;
    }
}
