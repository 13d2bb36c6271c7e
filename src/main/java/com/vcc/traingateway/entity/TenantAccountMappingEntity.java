package com.vcc.traingateway.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Tenant to account link. The logical key is (tenant_id, account_id); mapping_id only exists
 * because R2DBC repositories need a single-column id.
 */
@Table("tenant_account_mappings")
public class TenantAccountMappingEntity {

    @Id
    @Column("mapping_id")
    private Long mappingId;

    @Column("tenant_id")
    private String tenantId;

    @Column("account_id")
    private String accountId;

    @Column("priority")
    private int priority;

    @Column("created_at")
    private Instant createdAt;

    public TenantAccountMappingEntity() {
    }

    public Long getMappingId() {
        return mappingId;
    }

    public void setMappingId(Long mappingId) {
        this.mappingId = mappingId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
