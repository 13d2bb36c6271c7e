package com.vcc.traingateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameClientKeyRequest(
        @NotBlank(message = "Label is required")
        @Size(max = 255, message = "Label must be at most 255 characters")
        String label
) {}
