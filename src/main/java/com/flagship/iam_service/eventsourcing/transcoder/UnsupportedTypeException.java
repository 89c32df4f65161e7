package com.flagship.iam_service.eventsourcing.transcoder;

/**
 * A value or tag has no registered transcoding.
 */
public class UnsupportedTypeException extends RuntimeException {

    public UnsupportedTypeException(Class<?> type) {
        super("No transcoding registered for type: " + type.getName());
    }

    public UnsupportedTypeException(String name) {
        super("No transcoding registered under name: " + name);
    }
}
