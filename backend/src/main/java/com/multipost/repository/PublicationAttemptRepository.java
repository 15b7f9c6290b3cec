package com.multipost.repository;

import com.multipost.model.PublicationAttempt;
import com.multipost.model.PublicationAttemptStatus;
import com.multipost.model.SocialNetwork;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PublicationAttemptRepository extends JpaRepository<PublicationAttempt, UUID> {

    List<PublicationAttempt> findByContentItemIdOrderByCreatedAtAsc(UUID contentItemId);

    List<PublicationAttempt> findByContentItemIdAndStatusOrderByCreatedAtAsc(
            UUID contentItemId,
            PublicationAttemptStatus status
    );

    List<PublicationAttempt> findByContentItemIdAndNetworkInAndStatus(
            UUID contentItemId,
            Collection<SocialNetwork> networks,
            PublicationAttemptStatus status
    );

    @Query("select a.status from PublicationAttempt a where a.contentItemId = :contentItemId")
    List<PublicationAttemptStatus> findStatusesByContentItemId(@Param("contentItemId") UUID contentItemId);

    @Query("""
            select a.contentItemId as contentItemId, count(a) as attemptCount
            from PublicationAttempt a
            where a.contentItemId in :contentItemIds
            group by a.contentItemId
            """)
    List<PublicationAttemptCountRow> countByContentItemIds(@Param("contentItemIds") Collection<UUID> contentItemIds);

    @Query("select a.adaptedContent from PublicationAttempt a where a.publicationAttemptId = :publicationAttemptId")
    Optional<String> findAdaptedContentById(@Param("publicationAttemptId") UUID publicationAttemptId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from PublicationAttempt a where a.publicationAttemptId = :publicationAttemptId")
    Optional<PublicationAttempt> findByIdForUpdate(@Param("publicationAttemptId") UUID publicationAttemptId);

    /**
     * Moves a pending attempt to processing. Returns 0 when another caller claimed it first.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update PublicationAttempt a
            set a.status = com.multipost.model.PublicationAttemptStatus.PROCESSING,
                a.imageUrl = :imageUrl,
                a.retryCount = 0,
                a.updatedAt = :now
            where a.publicationAttemptId = :publicationAttemptId
              and a.status = com.multipost.model.PublicationAttemptStatus.PENDING
            """)
    int claimPendingForDispatch(
            @Param("publicationAttemptId") UUID publicationAttemptId,
            @Param("imageUrl") String imageUrl,
            @Param("now") OffsetDateTime now
    );

    @Modifying(flushAutomatically = true)
    @Query("""
            update PublicationAttempt a
            set a.status = com.multipost.model.PublicationAttemptStatus.PROCESSING,
                a.retryCount = 0,
                a.updatedAt = :now
            where a.publicationAttemptId = :publicationAttemptId
              and a.status = :expectedStatus
            """)
    int claimForRetry(
            @Param("publicationAttemptId") UUID publicationAttemptId,
            @Param("expectedStatus") PublicationAttemptStatus expectedStatus,
            @Param("now") OffsetDateTime now
    );

    @Modifying(flushAutomatically = true)
    @Query("""
            update PublicationAttempt a
            set a.status = :nextStatus,
                a.updatedAt = :now
            where a.publicationAttemptId = :publicationAttemptId
              and a.status = :expectedStatus
            """)
    int compareAndSetStatus(
            @Param("publicationAttemptId") UUID publicationAttemptId,
            @Param("expectedStatus") PublicationAttemptStatus expectedStatus,
            @Param("nextStatus") PublicationAttemptStatus nextStatus,
            @Param("now") OffsetDateTime now
    );

    @Modifying
    @Query("delete from PublicationAttempt a where a.contentItemId = :contentItemId")
    int deleteByContentItemId(@Param("contentItemId") UUID contentItemId);
}
