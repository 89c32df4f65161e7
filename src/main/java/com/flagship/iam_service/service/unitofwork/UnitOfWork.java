package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;

import java.util.List;

/**
 * Scope of one persistence transaction.
 *
 * State machine: IDLE -> OPEN -> COMMITTED | ROLLED_BACK -> IDLE.
 *
 * users() and groups() are two handles on one event store proxy: both read
 * and append the same event log and share the same backlogs. They differ
 * only in the aggregate type they hydrate.
 *
 * Typical use inside a handler:
 * <pre>
 * try (UnitOfWork work = uow.begin()) {
 *     work.users().add(user);
 *     work.commit();
 * }
 * </pre>
 * Leaving the block without commit() rolls back.
 */
public interface UnitOfWork extends AutoCloseable {

    enum State {
        IDLE,
        OPEN,
        COMMITTED,
        ROLLED_BACK
    }

    /**
     * Starts a transaction.
     *
     * @throws IllegalStateException if a transaction is already open
     */
    UnitOfWork begin();

    AggregateRepository<User> users();

    AggregateRepository<Group> groups();

    OutboxRepository outboxes();

    /**
     * Writes one outbox row per externally-notifiable event, then commits.
     */
    void commit();

    /**
     * Rolls back an open transaction. No-op otherwise.
     */
    void rollback();

    /**
     * Drains a backlog across repositories in fixed order (users, groups,
     * outboxes), FIFO within each.
     */
    List<DomainEvent> collectBacklogs(Backlog backlog);

    State getState();

    /**
     * Rolls back if still open and returns to IDLE.
     */
    @Override
    void close();
}
