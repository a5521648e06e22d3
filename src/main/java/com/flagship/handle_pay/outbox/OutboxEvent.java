package com.flagship.handle_pay.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the transactional outbox.
 *
 * Written in the same transaction as the state change it describes and
 * published to Kafka later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "Vault"
    String aggregateKey;       // identity hash, batch id or component name
    String eventType;          // e.g. "Withdrawn"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateKey,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateKey,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
