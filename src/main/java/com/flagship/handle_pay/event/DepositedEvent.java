package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when funds are credited to a handle's vault balance.
 */
@Value
public class DepositedEvent implements ProtocolEvent {
    UUID eventId;
    Address depositor;
    String handle;
    String identityHash;
    AssetId asset;
    BigInteger amount;
    BigInteger balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Deposited";

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
