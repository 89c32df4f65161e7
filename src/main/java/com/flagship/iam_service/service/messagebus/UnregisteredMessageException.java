package com.flagship.iam_service.service.messagebus;

/**
 * No handler is registered for the message type.
 */
public class UnregisteredMessageException extends RuntimeException {

    public UnregisteredMessageException(Class<?> messageType) {
        super("No handler registered for " + messageType.getName());
    }
}
