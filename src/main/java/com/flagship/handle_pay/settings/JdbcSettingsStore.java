package com.flagship.handle_pay.settings;

import com.flagship.handle_pay.asset.Address;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * {@code component_settings} table, one row per {@link ProtocolComponent}.
 */
@Repository
@Slf4j
public class JdbcSettingsStore implements SettingsStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcSettingsStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ComponentSettings> find(ProtocolComponent component) {
        List<ComponentSettings> rows = jdbcTemplate.query(
            "SELECT component, owner, fee_rate_bps, fee_receiver FROM component_settings WHERE component = ?",
            settingsRowMapper(),
            component.name()
        );
        return rows.stream().findFirst();
    }

    @Override
    public void save(ComponentSettings settings) {
        int updated = jdbcTemplate.update(
            "UPDATE component_settings SET owner = ?, fee_rate_bps = ?, fee_receiver = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE component = ?",
            settings.getOwner().getValue(),
            settings.getFeeRateBps(),
            settings.getFeeReceiver().getValue(),
            settings.getComponent().name()
        );
        if (updated == 0) {
            throw new IllegalStateException("Settings not initialized for " + settings.getComponent());
        }
    }

    @Override
    public boolean initializeIfAbsent(ComponentSettings defaults) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO component_settings (component, owner, fee_rate_bps, fee_receiver, updated_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT (component) DO NOTHING",
            defaults.getComponent().name(),
            defaults.getOwner().getValue(),
            defaults.getFeeRateBps(),
            defaults.getFeeReceiver().getValue()
        );
        log.debug("Settings for {} {}", defaults.getComponent(), inserted == 1 ? "initialized" : "already present");
        return inserted == 1;
    }

    private RowMapper<ComponentSettings> settingsRowMapper() {
        return (rs, rowNum) -> new ComponentSettings(
            ProtocolComponent.valueOf(rs.getString("component")),
            Address.of(rs.getString("owner")),
            rs.getInt("fee_rate_bps"),
            Address.of(rs.getString("fee_receiver"))
        );
    }
}
