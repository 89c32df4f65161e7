package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.outbox.OutboxStore;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Unit of work on a Spring transaction.
 *
 * Each begin() starts a new transaction bound to the current thread. The
 * JDBC recorder and the JPA outbox store both join it, so event rows and
 * outbox rows commit or roll back together.
 */
public class TransactionalUnitOfWork extends AbstractUnitOfWork {

    private final PlatformTransactionManager transactionManager;
    private final TransactionDefinition definition;
    private TransactionStatus status;

    public TransactionalUnitOfWork(PlatformTransactionManager transactionManager, EventMapper mapper,
                                   ApplicationRecorder recorder, OutboxStore outboxStore) {
        super(mapper, recorder, outboxStore);
        this.transactionManager = transactionManager;
        this.definition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    protected void doBegin() {
        status = transactionManager.getTransaction(definition);
    }

    @Override
    protected void doCommit() {
        transactionManager.commit(status);
    }

    @Override
    protected void doRollback() {
        if (status != null && !status.isCompleted()) {
            transactionManager.rollback(status);
        }
    }
}
