package com.flagship.handle_pay.event;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.settings.ProtocolComponent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Administrative change to a component's settings.
 *
 * One class covers the three change kinds; {@link #getEventType()} tells them apart
 * and {@code previousValue}/{@code newValue} hold the rate or address before and after.
 */
@Value
public class SettingsChangedEvent implements ProtocolEvent {
    UUID eventId;
    ProtocolComponent component;
    String changeType;
    Address changedBy;
    String previousValue;
    String newValue;
    Instant occurredAt;

    public static final String FEE_RATE_UPDATED = "FeeRateUpdated";
    public static final String FEE_RECEIVER_UPDATED = "FeeReceiverUpdated";
    public static final String OWNERSHIP_TRANSFERRED = "OwnershipTransferred";

    @Override
    public String getEventType() {
        return changeType;
    }

    @Override
    public String getAggregateType() {
        return component.aggregateType();
    }

    @Override
    public String getAggregateKey() {
        return component.name();
    }

    public static SettingsChangedEvent of(ProtocolComponent component, String changeType, Address changedBy,
                                          Object previousValue, Object newValue) {
        return new SettingsChangedEvent(UUID.randomUUID(), component, changeType, changedBy,
            String.valueOf(previousValue), String.valueOf(newValue), Instant.now());
    }
}
