package com.multipost.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "publication_attempts")
public class PublicationAttempt {

    @Id
    @Column(name = "publication_attempt_id", nullable = false, updatable = false)
    private UUID publicationAttemptId;

    @Column(name = "content_item_id", nullable = false, updatable = false)
    private UUID contentItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "network", nullable = false, length = 32, updatable = false)
    private SocialNetwork network;

    @Column(name = "adapted_content", columnDefinition = "TEXT")
    private String adaptedContent;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PublicationAttemptStatus status = PublicationAttemptStatus.PENDING;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false)
    private JsonNode metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
