package com.vcc.traingateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;

/**
 * Partial tenant update. Null fields are left unchanged; an empty defaultAccountId clears it.
 */
public record UpdateTenantRequest(
        @Size(max = 1024, message = "Description must be at most 1024 characters")
        String description,

        String defaultAccountId,

        Boolean active,

        JsonNode notificationConfig
) {}
