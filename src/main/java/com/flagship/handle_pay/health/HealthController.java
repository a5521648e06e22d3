package com.flagship.handle_pay.health;

import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import com.flagship.handle_pay.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Readiness of the protocol components, without actuator authorization.
 *
 * A component is ready once its settings row exists. Reading the rows also
 * proves the database is reachable; a failed read reports every component DOWN.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final SettingsStore settingsStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> components = new LinkedHashMap<>();
        boolean ready = true;

        for (ProtocolComponent component : ProtocolComponent.values()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            try {
                Optional<ComponentSettings> settings = settingsStore.find(component);
                detail.put("status", settings.isPresent() ? "UP" : "DOWN");
                settings.ifPresent(s -> {
                    detail.put("feeRateBps", s.getFeeRateBps());
                    detail.put("feeReceiver", s.getFeeReceiver().getValue());
                });
                ready &= settings.isPresent();
            } catch (DataAccessException e) {
                log.warn("Settings unreadable for {}: {}", component, e.getMessage());
                detail.put("status", "DOWN");
                detail.put("error", "settings store unavailable");
                ready = false;
            }
            components.put(component.name(), detail);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "handle-pay");
        response.put("status", ready ? "UP" : "DOWN");
        response.put("components", components);
        response.put("timestamp", Instant.now().toString());

        return ready ? ResponseEntity.ok(response) : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
