package com.aldar.middleware.model.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record FeedbackRequest(
        @NotBlank
        @Pattern(regexp = "thumbs_up|thumbs_down|neutral")
        String rating,
        @Size(max = 5000)
        String comment
) {
}
