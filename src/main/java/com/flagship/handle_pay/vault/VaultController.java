package com.flagship.handle_pay.vault;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.identity.HandleHash;
import com.flagship.handle_pay.observability.CorrelationIdFilter;
import com.flagship.handle_pay.vault.dto.BalanceResponse;
import com.flagship.handle_pay.vault.dto.BatchDepositRequest;
import com.flagship.handle_pay.vault.dto.DepositRequest;
import com.flagship.handle_pay.vault.dto.WithdrawRequest;
import com.flagship.handle_pay.vault.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
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
import java.util.List;
import java.util.Map;

/**
 * REST controller for direct vault access: deposits by anyone, withdrawals by
 * the registered owner of a handle.
 */
@RestController
@RequestMapping("/api/vault")
@RequiredArgsConstructor
public class VaultController {

    private final EscrowVault vault;

    @PostMapping("/deposits")
    public ResponseEntity<BalanceResponse> deposit(
            @Valid @RequestBody DepositRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        BigInteger balanceAfter = vault.deposit(
            Address.of(callerHeader), request.getHandle(), request.getAmount(), request.getAsset());
        return ResponseEntity.status(HttpStatus.CREATED).body(new BalanceResponse(
            request.getHandle(), HandleHash.of(request.getHandle()),
            AssetId.orNative(request.getAsset()), balanceAfter));
    }

    @PostMapping("/deposits/batch")
    public ResponseEntity<Map<String, Object>> batchDeposit(
            @Valid @RequestBody BatchDepositRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        BigInteger total = vault.batchDeposit(Address.of(callerHeader), request.getHandles(),
            request.getAmounts(), request.getAsset(), request.getAttachedValue());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("asset", AssetId.orNative(request.getAsset()));
        response.put("entries", request.getHandles().size());
        response.put("total", total);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<WithdrawalResponse> withdraw(
            @Valid @RequestBody WithdrawRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        WithdrawalResult result = vault.withdraw(Address.of(callerHeader), request.getHandle(), request.getAsset());
        return ResponseEntity.ok(WithdrawalResponse.from(result));
    }

    @PostMapping("/withdrawals/all")
    public ResponseEntity<List<WithdrawalResponse>> withdrawAll(
            @Valid @RequestBody WithdrawRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {
        List<AssetId> assets = request.getAssets() == null ? List.of() : request.getAssets();
        List<WithdrawalResult> results = vault.withdrawAll(Address.of(callerHeader), request.getHandle(), assets);
        return ResponseEntity.ok(results.stream().map(WithdrawalResponse::from).toList());
    }

    @GetMapping("/balances/{handle}")
    public ResponseEntity<BalanceResponse> balance(
            @PathVariable("handle") String handle,
            @RequestParam(value = "asset", required = false) String asset) {
        AssetId resolvedAsset = asset == null ? AssetId.NATIVE : AssetId.of(asset);
        return ResponseEntity.ok(new BalanceResponse(
            handle, HandleHash.of(handle), resolvedAsset, vault.balanceOf(handle, resolvedAsset)));
    }
}
