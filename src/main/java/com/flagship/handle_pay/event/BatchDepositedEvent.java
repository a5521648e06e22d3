package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per batch deposit. Individual credits are listed in order.
 */
@Value
public class BatchDepositedEvent implements ProtocolEvent {
    UUID eventId;
    UUID batchId;
    Address depositor;
    AssetId asset;
    BigInteger total;
    List<Credit> credits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BatchDeposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Vault";
    }

    @Override
    public String getAggregateKey() {
        return batchId.toString();
    }

    @Value
    public static class Credit {
        String handle;
        String identityHash;
        BigInteger amount;
    }
}
