package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a batch transfer completes. {@code fee} includes rounding dust.
 */
@Value
public class BatchTransferCompletedEvent implements ProtocolEvent {
    UUID eventId;
    UUID batchId;
    Address sender;
    AssetId asset;
    int escrowedCount;
    BigInteger escrowedTotal;
    int directCount;
    BigInteger directTotal;
    BigInteger directPaid;
    BigInteger fee;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BatchTransferCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Dispatcher";
    }

    @Override
    public String getAggregateKey() {
        return batchId.toString();
    }
}
