package com.flagship.iam_service.service.unitofwork;

/**
 * The two kinds of event backlog a unit of work keeps.
 */
public enum Backlog {
    /** Events fed back into the message bus queue. */
    INTERNAL,
    /** Events staged into the outbox on commit. */
    EXTERNAL
}
