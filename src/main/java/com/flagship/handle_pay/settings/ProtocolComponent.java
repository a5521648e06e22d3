package com.flagship.handle_pay.settings;

/**
 * Components that carry their own owner, fee rate and fee receiver.
 */
public enum ProtocolComponent {

    /**
     * Direct transfers. Fee charged at send time.
     */
    DISPATCHER(300),

    /**
     * Escrow vault. Fee charged at withdrawal time.
     */
    VAULT(1000);

    private final int maxFeeRateBps;

    ProtocolComponent(int maxFeeRateBps) {
        this.maxFeeRateBps = maxFeeRateBps;
    }

    public int getMaxFeeRateBps() {
        return maxFeeRateBps;
    }

    /**
     * Aggregate type used for this component's outbox events.
     */
    public String aggregateType() {
        return switch (this) {
            case DISPATCHER -> "Dispatcher";
            case VAULT -> "Vault";
        };
    }
}
