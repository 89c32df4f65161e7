package com.flagship.iam_service.outbox;

/**
 * Write side of the outbox, used from inside a unit of work. Reading rows
 * back is left to OutboxService.
 */
public interface OutboxStore {

    /**
     * Writes a row within the caller's open transaction.
     */
    void append(OutboxEvent event);
}
