package com.vcc.traingateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for issuing a tenant client key.
 */
public record CreateClientKeyRequest(
        @Size(max = 255, message = "Label must be at most 255 characters")
        String label,

        @NotBlank(message = "Creator is required")
        @Size(max = 255, message = "Creator must be at most 255 characters")
        String createdBy
) {}
