package com.flagship.iam_service.observability;

import com.flagship.iam_service.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the transactional outbox.
 *
 * These metrics show whether the publishing worker keeps up:
 * - Backlog size: how many rows are waiting to be processed
 * - Oldest row age: how long the oldest unprocessed row has been waiting
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    // Cached values updated periodically (avoid hitting DB on every scrape)
    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("iam.outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unprocessed rows in the outbox")
                .register(meterRegistry);

        Gauge.builder("iam.outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unprocessed outbox row in seconds")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached metric values.
     * Called periodically by the scheduler.
     */
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unprocessed = outboxRepository.countUnprocessed();
            backlogSize.set(unprocessed);

            outboxRepository.findOldestUnprocessedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> {
                                long ageSeconds = Duration.between(oldest, Instant.now()).getSeconds();
                                oldestEventAgeSeconds.set(Math.max(0, ageSeconds));
                            },
                            () -> oldestEventAgeSeconds.set(0)
                    );

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s",
                    unprocessed, oldestEventAgeSeconds.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }
}
