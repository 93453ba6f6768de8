package com.vcc.governance.entity;

import com.vcc.governance.model.UsageRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Table("usage_record")
public class UsageRecordEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("tenant_id")
    private String tenantId;

    @Column("user_id")
    private String userId;

    @Column("resource_type")
    private String resourceType;

    @Column("quantity")
    private long quantity;

    @Column("unit_type")
    private String unitType;

    @Column("endpoint_path")
    private String endpointPath;

    @Column("request_method")
    private String requestMethod;

    @Column("response_status")
    private int responseStatus;

    @Column("processing_time_ms")
    private long processingTimeMs;

    @Column("billing_tier")
    private String billingTier;

    @Column("recorded_at")
    private Instant recordedAt;

    public UsageRecordEntity() {
    }

    /**
     * Create a new (unsaved) row from a usage record.
     */
    public static UsageRecordEntity fromRecord(UsageRecord record) {
        UsageRecordEntity entity = new UsageRecordEntity();
        entity.setTenantId(record.tenantId());
        entity.setUserId(record.userId());
        entity.setResourceType(record.category().key());
        entity.setQuantity(record.quantity());
        entity.setUnitType(record.unit());
        entity.setEndpointPath(record.endpoint());
        entity.setRequestMethod(record.method());
        entity.setResponseStatus(record.responseStatus());
        entity.setProcessingTimeMs(record.processingTimeMs());
        entity.setBillingTier(record.billingTier());
        entity.setRecordedAt(record.recordedAt());
        return entity;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public String getResourceType() {
        return resourceType;
    }

    public void setResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    public long getQuantity() {
        return quantity;
    }

    public void setQuantity(long quantity) {
        this.quantity = quantity;
    }

    public String getUnitType() {
        return unitType;
    }

    public void setUnitType(String unitType) {
        this.unitType = unitType;
    }

    public String getEndpointPath() {
        return endpointPath;
    }

    public void setEndpointPath(String endpointPath) {
        this.endpointPath = endpointPath;
    }

    public String getRequestMethod() {
        return requestMethod;
    }

    public void setRequestMethod(String requestMethod) {
        this.requestMethod = requestMethod;
    }

    public int getResponseStatus() {
        return responseStatus;
    }

    public void setResponseStatus(int responseStatus) {
        this.responseStatus = responseStatus;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public String getBillingTier() {
        return billingTier;
    }

    public void setBillingTier(String billingTier) {
        this.billingTier = billingTier;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(Instant recordedAt) {
        this.recordedAt = recordedAt;
    }
}
