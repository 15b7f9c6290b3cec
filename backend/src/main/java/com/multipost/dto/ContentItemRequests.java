package com.multipost.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class ContentItemRequests {

    private ContentItemRequests() {
    }

    public record CreateContentItemRequest(
            @NotBlank(message = "title is required")
            @Size(max = 500, message = "title must be at most 500 characters")
            String title,

            @NotBlank(message = "content is required")
            @Size(max = 20000, message = "content must be at most 20000 characters")
            String content
    ) {
    }

    /**
     * {@code networks} left out means the configured default set. An empty list is rejected.
     */
    public record AdaptContentRequest(
            List<String> networks,
            Boolean previewOnly
    ) {
        public boolean isPreview() {
            return Boolean.TRUE.equals(previewOnly);
        }
    }

    public record PublishRequest(
            @Size(max = 2048, message = "imageUrl must be at most 2048 characters")
            String imageUrl
    ) {
    }
}
