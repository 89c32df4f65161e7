package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.outbox.OutboxStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * State machine and backlog handling shared by unit of work implementations.
 * Subclasses only begin, commit and roll back the underlying transaction.
 *
 * The repositories live as long as the unit of work, so internal events of
 * a committed transaction stay available to the message bus after close().
 * Events staged by a transaction that rolls back are dropped.
 */
@Slf4j
public abstract class AbstractUnitOfWork implements UnitOfWork {

    private final AggregateRepository<User> users;
    private final AggregateRepository<Group> groups;
    private final OutboxRepository outboxes;

    private State state = State.IDLE;
    private int internalBacklogMark;

    protected AbstractUnitOfWork(EventMapper mapper, ApplicationRecorder recorder, OutboxStore outboxStore) {
        EventStoreProxy eventStore = new EventStoreProxy(mapper, recorder);
        // users and groups share one proxy: same log, same backlogs
        this.users = new AggregateRepository<>(eventStore, User.class);
        this.groups = new AggregateRepository<>(eventStore, Group.class);
        this.outboxes = new OutboxRepository(mapper, outboxStore);
    }

    protected abstract void doBegin();

    protected abstract void doCommit();

    protected abstract void doRollback();

    @Override
    public UnitOfWork begin() {
        if (state == State.OPEN) {
            throw new IllegalStateException("Unit of work is already open");
        }
        doBegin();
        internalBacklogMark = users.eventStore().size(Backlog.INTERNAL);
        state = State.OPEN;
        return this;
    }

    @Override
    public AggregateRepository<User> users() {
        requireOpen();
        return users;
    }

    @Override
    public AggregateRepository<Group> groups() {
        requireOpen();
        return groups;
    }

    @Override
    public OutboxRepository outboxes() {
        requireOpen();
        return outboxes;
    }

    @Override
    public void commit() {
        requireOpen();
        List<DomainEvent> external = collectBacklogs(Backlog.EXTERNAL);
        try {
            external.forEach(outboxes::add);
            doCommit();
        } catch (RuntimeException e) {
            log.warn("Commit failed, rolling back: {}", e.getMessage());
            rollback();
            throw e;
        }
        state = State.COMMITTED;
        if (!external.isEmpty()) {
            log.info("Committed unit of work with {} outbox event(s)", external.size());
        }
    }

    @Override
    public void rollback() {
        if (state != State.OPEN) {
            return;
        }
        users.eventStore().truncate(Backlog.INTERNAL, internalBacklogMark);
        users.eventStore().truncate(Backlog.EXTERNAL, 0);
        try {
            doRollback();
        } finally {
            state = State.ROLLED_BACK;
        }
    }

    @Override
    public List<DomainEvent> collectBacklogs(Backlog backlog) {
        List<DomainEvent> collected = new ArrayList<>();
        collected.addAll(users.drainBacklog(backlog));
        collected.addAll(groups.drainBacklog(backlog));
        // outboxes keep no backlog of their own
        return collected;
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public void close() {
        if (state == State.OPEN) {
            log.warn("Unit of work closed without commit, rolling back");
            rollback();
        }
        state = State.IDLE;
    }

    private void requireOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Unit of work is not open: " + state);
        }
    }
}
