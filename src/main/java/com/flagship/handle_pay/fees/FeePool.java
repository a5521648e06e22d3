package com.flagship.handle_pay.fees;

import com.flagship.handle_pay.settings.ProtocolComponent;

/**
 * Independent accumulated-fee pools. Direct-transfer fees accrue in DISPATCHER,
 * escrow-withdrawal fees in VAULT.
 */
public enum FeePool {
    DISPATCHER(ProtocolComponent.DISPATCHER),
    VAULT(ProtocolComponent.VAULT);

    private final ProtocolComponent component;

    FeePool(ProtocolComponent component) {
        this.component = component;
    }

    public ProtocolComponent getComponent() {
        return component;
    }
}
