package com.flagship.iam_service.outbox;

import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read and acknowledge side of the outbox, used by publishing workers.
 *
 * Rows are written by the unit of work on commit, never here. A worker:
 * 1. Calls findUnprocessed() to fetch a batch with decoded events
 * 2. Publishes each event
 * 3. Calls markProcessed() for every row it published
 *
 * A row is published at least once; a worker that dies between steps 2
 * and 3 publishes it again on the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final EventMapper eventMapper;

    /**
     * Finds unprocessed rows, oldest first, with their domain events.
     *
     * @param limit Maximum number of rows to fetch
     */
    @Transactional(readOnly = true)
    public List<OutboxMessage> findUnprocessed(int limit) {
        return repository.findUnprocessed(PageRequest.of(0, limit))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .map(this::toMessage)
                .toList();
    }

    /**
     * Marks a row as processed.
     *
     * @return false if the row does not exist or was already processed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markProcessed(UUID outboxId) {
        boolean updated = repository.markProcessed(outboxId) > 0;
        if (updated) {
            log.debug("Marked outbox event {} as processed", outboxId);
        } else {
            log.warn("Outbox event {} not found or already processed", outboxId);
        }
        return updated;
    }

    /**
     * Gets rows for a specific aggregate (for debugging/auditing).
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(UUID aggregateId) {
        return repository.findByAggregateIdOrderByCreatedAtAsc(aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    /**
     * Counts unprocessed rows (for monitoring).
     */
    @Transactional(readOnly = true)
    public long countUnprocessed() {
        return repository.countUnprocessed();
    }

    private OutboxMessage toMessage(OutboxEvent row) {
        return new OutboxMessage(row,
                eventMapper.outboxStateToDomainEvent(row.getAggregateId(), row.getTopic(), row.getState()));
    }
}
