package com.vcc.traingateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating a new tenant ("train").
 */
public record CreateTenantRequest(
        @NotBlank(message = "Tenant ID is required")
        @Size(min = 3, max = 64, message = "Tenant ID must be 3-64 characters")
        @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "Tenant ID can only contain letters, numbers, underscores, and hyphens")
        String tenantId,

        @Size(max = 1024, message = "Description must be at most 1024 characters")
        String description,

        String defaultAccountId,

        // Opaque, stored and returned unchanged
        JsonNode notificationConfig
) {}
