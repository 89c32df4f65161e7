package com.flagship.iam_service.eventsourcing.recorder;

/**
 * An append violated a store constraint or failed in storage.
 * The enclosing unit of work must roll back.
 */
public class RecorderIntegrityException extends RuntimeException {

    public RecorderIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
