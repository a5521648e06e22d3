package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a stakeholder claims its share of the distributor's holdings.
 */
@Value
public class ShareClaimedEvent implements ProtocolEvent {
    UUID eventId;
    Address stakeholder;
    AssetId asset;
    BigInteger heldBefore;
    int shareBps;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShareClaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "FeeDistributor";
    }

    @Override
    public String getAggregateKey() {
        return stakeholder.getValue();
    }
}
