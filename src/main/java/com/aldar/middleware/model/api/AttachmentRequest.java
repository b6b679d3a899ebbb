package com.aldar.middleware.model.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttachmentRequest(
        String attachmentId,
        String fileName,
        Long fileSize,
        String contentType,
        @NotBlank
        String url
) {
}
