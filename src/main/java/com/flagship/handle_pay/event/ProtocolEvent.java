package com.flagship.handle_pay.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for protocol events.
 *
 * Events are facts about committed state changes. They carry the before/after
 * or delta values needed for off-chain reconciliation and are written to the
 * outbox in the same transaction as the change they describe.
 */
public interface ProtocolEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * Component that emitted the event, e.g. "Vault".
     */
    String getAggregateType();

    /**
     * Partition key. Events about the same identity or component share one key.
     */
    String getAggregateKey();

    Instant getOccurredAt();

    String getEventType();
}
