package com.flagship.iam_service.service.unitofwork;

/**
 * Creates one unit of work per message bus run.
 */
@FunctionalInterface
public interface UnitOfWorkFactory {

    UnitOfWork create();
}
