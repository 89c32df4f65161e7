package com.flagship.iam_service.observability;

import com.flagship.iam_service.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the outbox backlog.
 * Unhealthy if too many rows are waiting to be processed.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    private final OutboxEventRepository outboxRepository;
    private final long warningThreshold;
    private final long criticalThreshold;

    public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                 @Value("${iam.outbox.backlog.warning-threshold:1000}") long warningThreshold,
                                 @Value("${iam.outbox.backlog.critical-threshold:10000}") long criticalThreshold) {
        this.outboxRepository = outboxRepository;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    @Override
    public Health health() {
        try {
            long backlogSize = outboxRepository.countUnprocessed();

            Health.Builder builder = backlogSize < warningThreshold
                    ? Health.up()
                    : backlogSize < criticalThreshold
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", warningThreshold)
                    .withDetail("criticalThreshold", criticalThreshold)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
