package com.aldar.middleware.model.api;

import jakarta.validation.constraints.NotBlank;

public record RegisterAgentRequest(
        @NotBlank
        String name
) {
}
