package com.flagship.iam_service.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics for message bus dispatch.
 *
 * Metrics exposed:
 * - iam.messagebus.handled: Counter of handler invocations, tagged by
 *   message type and outcome (success, failure, stopped)
 */
@Component
public class MessageBusMetrics {

    public enum Outcome {
        SUCCESS,
        FAILURE,
        STOPPED
    }

    private final MeterRegistry registry;

    public MessageBusMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordHandled(String messageType, Outcome outcome) {
        Counter.builder("iam.messagebus.handled")
                .description("Number of message handler invocations")
                .tag("message_type", messageType)
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public double handledCount(String messageType, Outcome outcome) {
        Counter counter = registry.find("iam.messagebus.handled")
                .tag("message_type", messageType)
                .tag("outcome", outcome.name().toLowerCase())
                .counter();
        return counter != null ? counter.count() : 0;
    }
}
