package com.flagship.iam_service.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for refreshing observable metrics.
 *
 * Periodically updates gauge metrics that require database queries.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "metrics.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}
