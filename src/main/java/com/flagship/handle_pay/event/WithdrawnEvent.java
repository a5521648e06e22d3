package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a handle owner drains a vault balance.
 * {@code gross = net + fee}; the balance is zero afterwards.
 */
@Value
public class WithdrawnEvent implements ProtocolEvent {
    UUID eventId;
    String handle;
    String identityHash;
    Address recipient;
    AssetId asset;
    BigInteger gross;
    BigInteger net;
    BigInteger fee;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Withdrawn";

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
        return identityHash;
    }
}
