package com.flagship.iam_service.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * OutboxStore on the iam_service_outbox table.
 *
 * IMPORTANT: append must run inside the unit of work's transaction.
 * MANDATORY propagation makes a call outside of one fail instead of
 * silently committing on its own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaOutboxStore implements OutboxStore {

    private final OutboxEventRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(OutboxEvent event) {
        repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Saved outbox event: topic={}, aggregateId={}", event.getTopic(), event.getAggregateId());
    }
}
