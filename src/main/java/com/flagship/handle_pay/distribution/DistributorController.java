package com.flagship.handle_pay.distribution;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.fees.dto.AssetsRequest;
import com.flagship.handle_pay.observability.CorrelationIdFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/distributor")
@RequiredArgsConstructor
public class DistributorController {

    private final FeeDistributor distributor;

    @PostMapping("/pull/dispatcher")
    public ResponseEntity<Map<AssetId, BigInteger>> pullFromDispatcher(
            @RequestBody AssetsRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        if (request.isMultiple()) {
            return ResponseEntity.ok(distributor.pullFromDispatcherMultiple(caller, request.getAssets()));
        }
        AssetId asset = AssetId.orNative(request.getAsset());
        return ResponseEntity.ok(Map.of(asset, distributor.pullFromDispatcher(caller, asset)));
    }

    @PostMapping("/pull/vault")
    public ResponseEntity<Map<AssetId, BigInteger>> pullFromVault(
            @RequestBody AssetsRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        if (request.isMultiple()) {
            return ResponseEntity.ok(distributor.pullFromVaultMultiple(caller, request.getAssets()));
        }
        AssetId asset = AssetId.orNative(request.getAsset());
        return ResponseEntity.ok(Map.of(asset, distributor.pullFromVault(caller, asset)));
    }

    @PostMapping("/shares/claim")
    public ResponseEntity<Map<AssetId, BigInteger>> claimShare(
            @RequestBody AssetsRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        AssetId asset = AssetId.orNative(request.getAsset());
        return ResponseEntity.ok(Map.of(asset, distributor.claimShare(Address.of(callerHeader), asset)));
    }

    @GetMapping("/shares/{address}")
    public ResponseEntity<Map<String, Object>> pendingShare(
            @PathVariable("address") String address,
            @RequestParam(value = "asset", required = false) String asset) {
        Address stakeholder = Address.of(address);
        AssetId resolvedAsset = asset == null ? AssetId.NATIVE : AssetId.of(asset);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("address", stakeholder);
        response.put("asset", resolvedAsset);
        response.put("held", distributor.heldBalance(resolvedAsset));
        response.put("pending_share", distributor.pendingShare(stakeholder, resolvedAsset));
        return ResponseEntity.ok(response);
    }
}
