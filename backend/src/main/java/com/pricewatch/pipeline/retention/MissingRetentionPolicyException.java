package com.pricewatch.pipeline.retention;

public class MissingRetentionPolicyException extends RuntimeException {
    private final String tenantId;

    public MissingRetentionPolicyException(String tenantId) {
        super("No retention policy configured for tenant " + tenantId);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
