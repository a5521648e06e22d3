package com.flagship.handle_pay.config;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetTransferGateway;
import com.flagship.handle_pay.asset.CustodyAccount;
import com.flagship.handle_pay.dispatch.TransferDispatcher;
import com.flagship.handle_pay.distribution.FeeDistributor;
import com.flagship.handle_pay.distribution.Stakeholder;
import com.flagship.handle_pay.fees.FeeClaimProcessor;
import com.flagship.handle_pay.fees.FeePoolStore;
import com.flagship.handle_pay.identity.IdentityLookup;
import com.flagship.handle_pay.observability.ProtocolMetrics;
import com.flagship.handle_pay.outbox.OutboxService;
import com.flagship.handle_pay.settings.SettingsAdministrator;
import com.flagship.handle_pay.settings.SettingsStore;
import com.flagship.handle_pay.vault.EscrowVault;
import com.flagship.handle_pay.vault.VaultBalanceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the three protocol components, each with its own custody address.
 */
@Configuration
@Slf4j
public class ProtocolConfig {

    @Bean
    public EscrowVault escrowVault(ProtocolProperties properties,
                                   IdentityLookup identityLookup,
                                   VaultBalanceStore balanceStore,
                                   FeePoolStore feePoolStore,
                                   SettingsStore settingsStore,
                                   AssetTransferGateway gateway,
                                   FeeClaimProcessor feeClaims,
                                   SettingsAdministrator administrator,
                                   OutboxService outboxService,
                                   ProtocolMetrics metrics) {
        CustodyAccount custody = new CustodyAccount(Address.of(properties.getVault().getCustody()), gateway);
        log.info("Escrow vault custody: {}", custody.getAddress().toChecksum());
        return new EscrowVault(identityLookup, balanceStore, feePoolStore, settingsStore, custody,
            feeClaims, administrator, outboxService, metrics);
    }

    @Bean
    public TransferDispatcher transferDispatcher(ProtocolProperties properties,
                                                 IdentityLookup identityLookup,
                                                 EscrowVault escrowVault,
                                                 FeePoolStore feePoolStore,
                                                 SettingsStore settingsStore,
                                                 AssetTransferGateway gateway,
                                                 FeeClaimProcessor feeClaims,
                                                 SettingsAdministrator administrator,
                                                 OutboxService outboxService,
                                                 ProtocolMetrics metrics) {
        CustodyAccount custody = new CustodyAccount(Address.of(properties.getDispatcher().getCustody()), gateway);
        log.info("Dispatcher custody: {}", custody.getAddress().toChecksum());
        return new TransferDispatcher(identityLookup, escrowVault, feePoolStore, settingsStore, custody,
            feeClaims, administrator, outboxService, metrics);
    }

    @Bean
    public FeeDistributor feeDistributor(ProtocolProperties properties,
                                         AssetTransferGateway gateway,
                                         TransferDispatcher transferDispatcher,
                                         EscrowVault escrowVault,
                                         OutboxService outboxService,
                                         ProtocolMetrics metrics) {
        ProtocolProperties.Distributor config = properties.getDistributor();
        CustodyAccount custody = new CustodyAccount(Address.of(config.getCustody()), gateway);
        log.info("Fee distributor custody: {}", custody.getAddress().toChecksum());
        return new FeeDistributor(
            custody,
            Address.of(config.getAdmin()),
            new Stakeholder(Address.of(config.getStakeholder1()), config.getShare1Bps()),
            new Stakeholder(Address.of(config.getStakeholder2()), config.getShare2Bps()),
            transferDispatcher,
            escrowVault,
            outboxService,
            metrics
        );
    }
}
