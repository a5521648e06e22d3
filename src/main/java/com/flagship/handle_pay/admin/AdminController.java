package com.flagship.handle_pay.admin;

import com.flagship.handle_pay.admin.dto.AddressRequest;
import com.flagship.handle_pay.admin.dto.FeeRateRequest;
import com.flagship.handle_pay.admin.dto.SettingsResponse;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.dispatch.TransferDispatcher;
import com.flagship.handle_pay.observability.CorrelationIdFilter;
import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import com.flagship.handle_pay.vault.EscrowVault;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Owner-only settings changes for the dispatcher and the vault.
 * {@code component} is {@code dispatcher} or {@code vault}.
 */
@RestController
@RequestMapping("/api/admin/{component}")
@RequiredArgsConstructor
public class AdminController {

    private final TransferDispatcher dispatcher;
    private final EscrowVault vault;

    @GetMapping
    public ResponseEntity<SettingsResponse> settings(@PathVariable("component") String component) {
        ComponentSettings settings = switch (parse(component)) {
            case DISPATCHER -> dispatcher.settings();
            case VAULT -> vault.settings();
        };
        return ResponseEntity.ok(SettingsResponse.from(settings));
    }

    @PutMapping("/fee-rate")
    public ResponseEntity<SettingsResponse> setFeeRate(
            @PathVariable("component") String component,
            @Valid @RequestBody FeeRateRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        ComponentSettings updated = switch (parse(component)) {
            case DISPATCHER -> dispatcher.setFeeRate(caller, request.getFeeRateBps());
            case VAULT -> vault.setFeeRate(caller, request.getFeeRateBps());
        };
        return ResponseEntity.ok(SettingsResponse.from(updated));
    }

    @PutMapping("/fee-receiver")
    public ResponseEntity<SettingsResponse> setFeeReceiver(
            @PathVariable("component") String component,
            @Valid @RequestBody AddressRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        ComponentSettings updated = switch (parse(component)) {
            case DISPATCHER -> dispatcher.setFeeReceiver(caller, request.getAddress());
            case VAULT -> vault.setFeeReceiver(caller, request.getAddress());
        };
        return ResponseEntity.ok(SettingsResponse.from(updated));
    }

    @PutMapping("/owner")
    public ResponseEntity<SettingsResponse> transferOwnership(
            @PathVariable("component") String component,
            @Valid @RequestBody AddressRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        ComponentSettings updated = switch (parse(component)) {
            case DISPATCHER -> dispatcher.transferOwnership(caller, request.getAddress());
            case VAULT -> vault.transferOwnership(caller, request.getAddress());
        };
        return ResponseEntity.ok(SettingsResponse.from(updated));
    }

    /**
     * @throws IllegalArgumentException for an unknown component name (mapped to 400)
     */
    private static ProtocolComponent parse(String component) {
        return ProtocolComponent.valueOf(component.toUpperCase(Locale.ROOT));
    }
}
