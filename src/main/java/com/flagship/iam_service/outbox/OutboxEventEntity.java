package com.flagship.iam_service.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the iam_service_outbox table.
 */
@Entity
@Table(name = "iam_service_outbox")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "topic", nullable = false, updatable = false)
    private String topic;

    @Column(name = "state", nullable = false, updatable = false)
    private byte[] state;

    @Column(name = "processed", nullable = false)
    private boolean processed = false;

    @Column(name = "create_dt", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Creates an entity from a domain object.
     */
    public static OutboxEventEntity fromDomain(OutboxEvent event) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.setId(event.getId());
        entity.setAggregateId(event.getAggregateId());
        entity.setTopic(event.getTopic());
        entity.setState(event.getState());
        entity.setProcessed(event.isProcessed());
        entity.setCreatedAt(event.getCreatedAt());
        return entity;
    }

    /**
     * Converts this entity to a domain object.
     */
    public OutboxEvent toDomain() {
        return new OutboxEvent(
            this.id,
            this.aggregateId,
            this.topic,
            this.state,
            this.processed,
            this.createdAt
        );
    }
}
