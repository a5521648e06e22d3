package com.flagship.handle_pay.settings;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.SettingsChangedEvent;
import com.flagship.handle_pay.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owner-gated setters for a component's settings. Each change is persisted and
 * recorded as a {@link SettingsChangedEvent} carrying the old and new value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettingsAdministrator {

    private final SettingsStore settingsStore;
    private final OutboxService outboxService;

    public ComponentSettings setFeeRate(ProtocolComponent component, Address caller, int feeRateBps) {
        ComponentSettings current = requireOwner(component, caller);
        ComponentSettings updated = current.withFeeRate(feeRateBps);
        apply(updated, SettingsChangedEvent.FEE_RATE_UPDATED, caller,
            current.getFeeRateBps(), updated.getFeeRateBps());
        return updated;
    }

    public ComponentSettings setFeeReceiver(ProtocolComponent component, Address caller, Address feeReceiver) {
        ComponentSettings current = requireOwner(component, caller);
        ComponentSettings updated = current.withFeeReceiver(feeReceiver);
        apply(updated, SettingsChangedEvent.FEE_RECEIVER_UPDATED, caller,
            current.getFeeReceiver(), updated.getFeeReceiver());
        return updated;
    }

    public ComponentSettings transferOwnership(ProtocolComponent component, Address caller, Address newOwner) {
        ComponentSettings current = requireOwner(component, caller);
        ComponentSettings updated = current.withOwner(newOwner);
        apply(updated, SettingsChangedEvent.OWNERSHIP_TRANSFERRED, caller,
            current.getOwner(), updated.getOwner());
        return updated;
    }

    private ComponentSettings requireOwner(ProtocolComponent component, Address caller) {
        ComponentSettings current = settingsStore.load(component);
        if (!current.isOwner(caller)) {
            log.warn("Rejected settings change on {} by non-owner {}", component, caller);
            throw ProtocolException.unauthorized("Only the " + component + " owner may change its settings");
        }
        return current;
    }

    private void apply(ComponentSettings updated, String changeType, Address caller,
                       Object previousValue, Object newValue) {
        settingsStore.save(updated);
        outboxService.record(SettingsChangedEvent.of(updated.getComponent(), changeType, caller,
            previousValue, newValue));
        log.info("{} on {}: {} -> {}", changeType, updated.getComponent(), previousValue, newValue);
    }
}
