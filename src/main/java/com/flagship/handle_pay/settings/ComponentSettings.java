package com.flagship.handle_pay.settings;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import lombok.Value;

/**
 * Mutable configuration of one component, persisted per component.
 *
 * Changes create a new instance; the owning component decides who may apply them.
 */
@Value
public class ComponentSettings {
    ProtocolComponent component;
    Address owner;
    int feeRateBps;
    Address feeReceiver;

    public static ComponentSettings initial(ProtocolComponent component, Address owner,
                                            int feeRateBps, Address feeReceiver) {
        owner.requireNonZero("Owner");
        feeReceiver.requireNonZero("Fee receiver");
        requireFeeRate(component, feeRateBps);
        return new ComponentSettings(component, owner, feeRateBps, feeReceiver);
    }

    public ComponentSettings withFeeRate(int newRateBps) {
        requireFeeRate(component, newRateBps);
        return new ComponentSettings(component, owner, newRateBps, feeReceiver);
    }

    public ComponentSettings withFeeReceiver(Address newReceiver) {
        newReceiver.requireNonZero("Fee receiver");
        return new ComponentSettings(component, owner, feeRateBps, newReceiver);
    }

    public ComponentSettings withOwner(Address newOwner) {
        newOwner.requireNonZero("Owner");
        return new ComponentSettings(component, newOwner, feeRateBps, feeReceiver);
    }

    public boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    public boolean isFeeReceiver(Address caller) {
        return feeReceiver.equals(caller);
    }

    private static void requireFeeRate(ProtocolComponent component, int feeRateBps) {
        if (feeRateBps < 0 || feeRateBps > component.getMaxFeeRateBps()) {
            throw new ProtocolException(ProtocolError.INVALID_FEE_RATE,
                String.format("%s fee rate must be between 0 and %d bps, got %d",
                    component, component.getMaxFeeRateBps(), feeRateBps));
        }
    }
}
