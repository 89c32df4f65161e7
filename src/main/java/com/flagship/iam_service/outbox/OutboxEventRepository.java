package com.flagship.iam_service.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for outbox rows.
 *
 * Provides methods for:
 * - Saving rows (done inside a unit of work commit)
 * - Finding unprocessed rows (done by the publishing worker)
 * - Marking rows as processed (done after successful publication)
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Finds unprocessed rows, oldest first.
     */
    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.processed = false
        ORDER BY e.createdAt ASC
        """)
    List<OutboxEventEntity> findUnprocessed(Pageable pageable);

    /**
     * Finds rows for a specific aggregate.
     * Useful for debugging and auditing.
     */
    List<OutboxEventEntity> findByAggregateIdOrderByCreatedAtAsc(UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.processed = false")
    long countUnprocessed();

    @Modifying
    @Query("UPDATE OutboxEventEntity e SET e.processed = true WHERE e.id = :id AND e.processed = false")
    int markProcessed(@Param("id") UUID id);

    /**
     * Finds the oldest unprocessed row's creation timestamp.
     * Used for lag monitoring.
     */
    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.processed = false
        """)
    Optional<Instant> findOldestUnprocessedCreatedAt();
}
