package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.TransferRoute;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a single transfer completes, whether paid directly or escrowed.
 * {@code recipient} is null for escrowed transfers.
 */
@Value
public class TransferCompletedEvent implements ProtocolEvent {
    UUID eventId;
    Address sender;
    String handle;
    String identityHash;
    Address recipient;
    AssetId asset;
    BigInteger amount;
    BigInteger netAmount;
    BigInteger fee;
    TransferRoute route;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCompleted";

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
        return identityHash;
    }

    public static TransferCompletedEvent of(Address sender, String handle, String identityHash, Address recipient,
                                            AssetId asset, BigInteger amount, BigInteger netAmount,
                                            BigInteger fee, TransferRoute route) {
        return new TransferCompletedEvent(UUID.randomUUID(), sender, handle, identityHash, recipient,
            asset, amount, netAmount, fee, route, Instant.now());
    }
}
