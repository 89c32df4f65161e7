package com.flagship.iam_service.domain.iam;

/**
 * The command is not allowed for this aggregate.
 */
public class InvalidOperationException extends RuntimeException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
