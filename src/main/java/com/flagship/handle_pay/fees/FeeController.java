package com.flagship.handle_pay.fees;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.TransferDispatcher;
import com.flagship.handle_pay.fees.dto.AssetsRequest;
import com.flagship.handle_pay.observability.CorrelationIdFilter;
import com.flagship.handle_pay.vault.EscrowVault;
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
import java.util.Locale;
import java.util.Map;

/**
 * Fee pool views and claims by the configured fee receivers.
 */
@RestController
@RequestMapping("/api/fees")
@RequiredArgsConstructor
public class FeeController {

    private final TransferDispatcher dispatcher;
    private final EscrowVault vault;

    @PostMapping("/dispatcher/claim")
    public ResponseEntity<Map<AssetId, BigInteger>> claimDispatcherFees(
            @RequestBody AssetsRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        if (request.isMultiple()) {
            return ResponseEntity.ok(dispatcher.claimFeesMultiple(caller, request.getAssets()));
        }
        AssetId asset = AssetId.orNative(request.getAsset());
        return ResponseEntity.ok(Map.of(asset, dispatcher.claimFees(caller, asset)));
    }

    @PostMapping("/vault/claim")
    public ResponseEntity<Map<AssetId, BigInteger>> claimVaultFees(
            @RequestBody AssetsRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        Address caller = Address.of(callerHeader);
        if (request.isMultiple()) {
            return ResponseEntity.ok(vault.claimFeesMultiple(caller, request.getAssets()));
        }
        AssetId asset = AssetId.orNative(request.getAsset());
        return ResponseEntity.ok(Map.of(asset, vault.claimFees(caller, asset)));
    }

    @GetMapping("/{pool}")
    public ResponseEntity<Map<String, Object>> accumulated(
            @PathVariable("pool") String pool,
            @RequestParam(value = "asset", required = false) String asset) {
        FeePool feePool = FeePool.valueOf(pool.toUpperCase(Locale.ROOT));
        AssetId resolvedAsset = asset == null ? AssetId.NATIVE : AssetId.of(asset);
        BigInteger amount = feePool == FeePool.DISPATCHER
            ? dispatcher.accumulatedFees(resolvedAsset)
            : vault.accumulatedFees(resolvedAsset);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("pool", feePool);
        response.put("asset", resolvedAsset);
        response.put("amount", amount);
        return ResponseEntity.ok(response);
    }
}
