package com.flagship.handle_pay.config;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import com.flagship.handle_pay.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds component settings from configuration when the database has none yet.
 * Existing rows win: admin changes survive restarts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettingsInitializer implements ApplicationRunner {

    private final ProtocolProperties properties;
    private final SettingsStore settingsStore;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        seed(ProtocolComponent.DISPATCHER, properties.getDispatcher());
        seed(ProtocolComponent.VAULT, properties.getVault());
    }

    private void seed(ProtocolComponent component, ProtocolProperties.Component config) {
        ComponentSettings defaults = ComponentSettings.initial(
            component,
            Address.of(config.getOwner()),
            config.getFeeRateBps(),
            Address.of(config.getFeeReceiver())
        );
        if (settingsStore.initializeIfAbsent(defaults)) {
            log.info("Initialized {} settings: owner={}, feeRateBps={}, feeReceiver={}",
                component, defaults.getOwner(), defaults.getFeeRateBps(), defaults.getFeeReceiver());
        } else {
            log.info("{} settings already present, configuration defaults ignored", component);
        }
    }
}
