package com.vcc.traingateway.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Map an account to a tenant. Re-submitting an existing pair updates its priority.
 */
public record MappingRequest(
        @NotBlank(message = "Account ID is required")
        String accountId,

        @Min(value = 0, message = "Priority must be non-negative")
        Integer priority
) {
    public int effectivePriority() {
        return priority != null ? priority : 0;
    }
}
