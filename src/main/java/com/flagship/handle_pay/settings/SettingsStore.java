package com.flagship.handle_pay.settings;

import java.util.Optional;

/**
 * Storage for per-component settings. Only the owning component writes its row.
 */
public interface SettingsStore {

    Optional<ComponentSettings> find(ProtocolComponent component);

    /**
     * @throws IllegalStateException if the component was never initialized
     */
    default ComponentSettings load(ProtocolComponent component) {
        return find(component).orElseThrow(() ->
            new IllegalStateException("Settings not initialized for " + component));
    }

    void save(ComponentSettings settings);

    /**
     * Stores {@code defaults} unless a row already exists.
     *
     * @return true if the defaults were written
     */
    boolean initializeIfAbsent(ComponentSettings defaults);
}
