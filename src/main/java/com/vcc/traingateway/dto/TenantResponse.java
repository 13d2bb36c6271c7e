package com.vcc.traingateway.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record TenantResponse(
        String tenantId,
        String description,
        String defaultAccountId,
        boolean active,
        JsonNode notificationConfig,
        Instant createdAt,
        Instant updatedAt
) {}
