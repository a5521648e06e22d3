package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.fees.FeePool;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an accumulated fee pool is drained to its receiver.
 */
@Value
public class FeesClaimedEvent implements ProtocolEvent {
    UUID eventId;
    FeePool pool;
    Address receiver;
    AssetId asset;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FeesClaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return pool.getComponent().aggregateType();
    }

    @Override
    public String getAggregateKey() {
        return pool.name();
    }
}
