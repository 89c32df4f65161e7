package com.flagship.iam_service.observability;

import java.util.UUID;

/**
 * Thread-local context for request id propagation.
 *
 * The entrypoint hands a request id to the message bus, which keeps it here
 * and in the logging MDC for the duration of one handle() call, so every
 * log statement of the run carries it.
 */
public final class RequestContext {

    public static final String REQUEST_ID_MDC_KEY = "requestId";

    private static final ThreadLocal<String> requestId = new ThreadLocal<>();

    private RequestContext() {
        // Utility class
    }

    /**
     * Gets the current request id, or generates a new one if not set.
     */
    public static String getRequestId() {
        String id = requestId.get();
        if (id == null) {
            id = generateRequestId();
            requestId.set(id);
        }
        return id;
    }

    /**
     * Sets the request id for the current thread; blank ids are replaced
     * with a generated one.
     */
    public static void setRequestId(String id) {
        if (id != null && !id.isBlank()) {
            requestId.set(id);
        } else {
            requestId.set(generateRequestId());
        }
    }

    public static void clear() {
        requestId.remove();
    }

    /**
     * Generates a new request id.
     * Uses a shorter format for readability in logs.
     */
    public static String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasRequestId() {
        return requestId.get() != null;
    }
}
