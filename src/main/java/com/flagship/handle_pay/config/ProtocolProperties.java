package com.flagship.handle_pay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the protocol components.
 *
 * Owner, fee rate and fee receiver values for the dispatcher and vault are only
 * initial values: they seed {@code component_settings} on first start and are
 * changed afterwards through the owner-gated admin operations.
 */
@ConfigurationProperties(prefix = "protocol")
@Getter
@Setter
public class ProtocolProperties {

    private final Component dispatcher = new Component();
    private final Component vault = new Component();
    private final Distributor distributor = new Distributor();

    /**
     * Token addresses checked by the vault solvency health indicator, in addition
     * to the native coin.
     */
    private List<String> trackedTokens = new ArrayList<>();

    @Getter
    @Setter
    public static class Component {

        /**
         * Address whose holdings are this component's held balance.
         */
        private String custody;

        private String owner;

        private int feeRateBps;

        private String feeReceiver;
    }

    @Getter
    @Setter
    public static class Distributor {

        private String custody;

        /**
         * May pull fees but not claim shares.
         */
        private String admin;

        private String stakeholder1;

        private int share1Bps = 1000;

        private String stakeholder2;

        private int share2Bps = 9000;
    }
}
