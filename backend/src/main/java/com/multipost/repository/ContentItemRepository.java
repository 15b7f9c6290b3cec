package com.multipost.repository;

import com.multipost.model.ContentItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ContentItem c where c.contentItemId = :contentItemId")
    Optional<ContentItem> findByIdForUpdate(@Param("contentItemId") UUID contentItemId);

    @Query(
            value = """
                    SELECT content_item.*
                    FROM content_items content_item
                    ORDER BY content_item.created_at DESC, content_item.content_item_id ASC
                    LIMIT :limit OFFSET :offset
                    """,
            nativeQuery = true
    )
    List<ContentItem> findPageNewestFirst(@Param("offset") int offset, @Param("limit") int limit);

    @Query(
            value = """
                    SELECT content_item.*
                    FROM content_items content_item
                    WHERE content_item.status = :status
                    ORDER BY content_item.created_at DESC, content_item.content_item_id ASC
                    LIMIT :limit OFFSET :offset
                    """,
            nativeQuery = true
    )
    List<ContentItem> findPageByStatusNewestFirst(
            @Param("status") String status,
            @Param("offset") int offset,
            @Param("limit") int limit
    );
}
