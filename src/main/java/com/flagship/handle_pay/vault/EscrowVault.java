package com.flagship.handle_pay.vault;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.Amounts;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.BasisPoints;
import com.flagship.handle_pay.asset.CustodyAccount;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.BatchDepositedEvent;
import com.flagship.handle_pay.event.DepositedEvent;
import com.flagship.handle_pay.event.WithdrawnEvent;
import com.flagship.handle_pay.fees.FeeClaimProcessor;
import com.flagship.handle_pay.fees.FeePool;
import com.flagship.handle_pay.fees.FeePoolStore;
import com.flagship.handle_pay.guard.ReentrancyGuard;
import com.flagship.handle_pay.identity.HandleHash;
import com.flagship.handle_pay.identity.IdentityLookup;
import com.flagship.handle_pay.observability.CorrelationContext;
import com.flagship.handle_pay.observability.ProtocolMetrics;
import com.flagship.handle_pay.outbox.OutboxService;
import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import com.flagship.handle_pay.settings.SettingsAdministrator;
import com.flagship.handle_pay.settings.SettingsStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Escrow ledger for handles that are not yet registered.
 *
 * Balances are keyed by (identity hash, asset). Anyone may deposit for any
 * handle; only the address the registry currently resolves the handle to may
 * withdraw, and a withdrawal always drains the whole entry net of the vault fee.
 *
 * Every mutating operation runs in one transaction under this vault's
 * {@link ReentrancyGuard}, and state is final before value leaves custody.
 */
@Slf4j
public class EscrowVault {

    private final IdentityLookup identityLookup;
    private final VaultBalanceStore balanceStore;
    private final FeePoolStore feePoolStore;
    private final SettingsStore settingsStore;
    private final CustodyAccount custody;
    private final FeeClaimProcessor feeClaims;
    private final SettingsAdministrator administrator;
    private final OutboxService outboxService;
    private final ProtocolMetrics metrics;
    private final ReentrancyGuard guard = new ReentrancyGuard("vault");

    public EscrowVault(IdentityLookup identityLookup,
                       VaultBalanceStore balanceStore,
                       FeePoolStore feePoolStore,
                       SettingsStore settingsStore,
                       CustodyAccount custody,
                       FeeClaimProcessor feeClaims,
                       SettingsAdministrator administrator,
                       OutboxService outboxService,
                       ProtocolMetrics metrics) {
        this.identityLookup = identityLookup;
        this.balanceStore = balanceStore;
        this.feePoolStore = feePoolStore;
        this.settingsStore = settingsStore;
        this.custody = custody;
        this.feeClaims = feeClaims;
        this.administrator = administrator;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    public Address getCustodyAddress() {
        return custody.getAddress();
    }

    /**
     * Moves {@code amount} from the caller into vault custody and credits it to
     * the handle. No fee, no authorization.
     *
     * @param asset null or {@link AssetId#NATIVE} for the native coin
     * @return the handle's balance after the credit
     */
    @Transactional
    public BigInteger deposit(Address caller, String handle, BigInteger amount, AssetId asset) {
        long startTime = System.currentTimeMillis();
        AssetId resolvedAsset = AssetId.orNative(asset);

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String identityHash = HandleHash.of(handle);
            Amounts.requirePositive(amount, "Deposit amount");
            MDC.put(CorrelationContext.HANDLE_HASH_MDC_KEY, identityHash);

            custody.receive(resolvedAsset, caller, amount);
            BigInteger balanceAfter = balanceStore.credit(identityHash, resolvedAsset, amount);

            outboxService.record(new DepositedEvent(UUID.randomUUID(), caller, handle, identityHash,
                resolvedAsset, amount, balanceAfter, Instant.now()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordVaultOperation("deposit", resolvedAsset, "success");
            metrics.recordLatency("vault_deposit", duration);
            log.info("Deposited to vault: asset={}, amount={}, balanceAfter={}, duration={}ms",
                resolvedAsset, amount, balanceAfter, duration);

            return balanceAfter;

        } catch (ProtocolException e) {
            metrics.recordRejection("vault_deposit", e.getError().name());
            log.warn("Vault deposit rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.HANDLE_HASH_MDC_KEY);
        }
    }

    /**
     * Credits several handles with one transfer into custody.
     *
     * For the native coin the caller attaches {@code attachedValue}, which must
     * equal the sum of {@code amounts} exactly. For a token the sum is pulled
     * once and {@code attachedValue} must be absent or zero.
     */
    @Transactional
    public BigInteger batchDeposit(Address caller, List<String> handles, List<BigInteger> amounts,
                                   AssetId asset, BigInteger attachedValue) {
        long startTime = System.currentTimeMillis();
        AssetId resolvedAsset = AssetId.orNative(asset);

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            if (handles.size() != amounts.size()) {
                throw new ProtocolException(ProtocolError.LENGTH_MISMATCH,
                    String.format("%d handles but %d amounts", handles.size(), amounts.size()));
            }
            if (handles.isEmpty()) {
                throw new ProtocolException(ProtocolError.EMPTY_BATCH, "Batch deposit has no entries");
            }
            handles.forEach(HandleHash::requireHandle);
            BigInteger total = Amounts.sum(amounts);
            Amounts.requireAttachedValue(resolvedAsset, total, attachedValue);

            custody.receive(resolvedAsset, caller, total);

            List<BatchDepositedEvent.Credit> credits = new ArrayList<>(handles.size());
            for (int i = 0; i < handles.size(); i++) {
                String identityHash = HandleHash.of(handles.get(i));
                balanceStore.credit(identityHash, resolvedAsset, amounts.get(i));
                credits.add(new BatchDepositedEvent.Credit(handles.get(i), identityHash, amounts.get(i)));
            }

            outboxService.record(new BatchDepositedEvent(UUID.randomUUID(), UUID.randomUUID(), caller,
                resolvedAsset, total, credits, Instant.now()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordVaultOperation("batch_deposit", resolvedAsset, "success");
            metrics.recordLatency("vault_batch_deposit", duration);
            log.info("Batch deposited to vault: asset={}, entries={}, total={}, duration={}ms",
                resolvedAsset, handles.size(), total, duration);

            return total;

        } catch (ProtocolException e) {
            metrics.recordRejection("vault_batch_deposit", e.getError().name());
            log.warn("Vault batch deposit rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        }
    }

    /**
     * Drains the caller's balance for {@code handle} and pays it out net of the vault fee.
     *
     * @throws ProtocolException UNAUTHORIZED if the handle does not currently resolve to the caller,
     *                           NOTHING_TO_WITHDRAW if the balance is zero
     */
    @Transactional
    public WithdrawalResult withdraw(Address caller, String handle, AssetId asset) {
        long startTime = System.currentTimeMillis();
        AssetId resolvedAsset = AssetId.orNative(asset);

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String identityHash = HandleHash.of(handle);
            MDC.put(CorrelationContext.HANDLE_HASH_MDC_KEY, identityHash);
            requireHandleOwner(caller, handle);

            WithdrawalResult result = drainTo(caller, handle, identityHash, resolvedAsset)
                .orElseThrow(() -> new ProtocolException(ProtocolError.NOTHING_TO_WITHDRAW,
                    "No " + resolvedAsset.kind() + " balance to withdraw for this handle"));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("vault_withdraw", duration);
            log.info("Withdrawal completed: asset={}, gross={}, net={}, fee={}, duration={}ms",
                resolvedAsset, result.getGross(), result.getNet(), result.getFee(), duration);

            return result;

        } catch (ProtocolException e) {
            metrics.recordVaultOperation("withdraw", resolvedAsset, "rejected");
            metrics.recordRejection("vault_withdraw", e.getError().name());
            log.warn("Withdrawal rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.HANDLE_HASH_MDC_KEY);
        }
    }

    /**
     * Withdraws the native balance (if funded) and then each listed asset under a
     * single authorization check. Zero balances are skipped.
     *
     * @throws ProtocolException NOTHING_TO_WITHDRAW if no balance at all was paid out
     */
    @Transactional
    public List<WithdrawalResult> withdrawAll(Address caller, String handle, List<AssetId> assets) {
        long startTime = System.currentTimeMillis();

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String identityHash = HandleHash.of(handle);
            MDC.put(CorrelationContext.HANDLE_HASH_MDC_KEY, identityHash);
            requireHandleOwner(caller, handle);

            List<WithdrawalResult> results = new ArrayList<>();
            drainTo(caller, handle, identityHash, AssetId.NATIVE).ifPresent(results::add);
            for (AssetId asset : assets) {
                drainTo(caller, handle, identityHash, AssetId.orNative(asset)).ifPresent(results::add);
            }

            if (results.isEmpty()) {
                throw new ProtocolException(ProtocolError.NOTHING_TO_WITHDRAW,
                    "No balance to withdraw for this handle in any requested asset");
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("vault_withdraw_all", duration);
            log.info("Withdraw-all completed: assetsPaid={}, duration={}ms", results.size(), duration);

            return results;

        } catch (ProtocolException e) {
            metrics.recordRejection("vault_withdraw_all", e.getError().name());
            log.warn("Withdraw-all rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.HANDLE_HASH_MDC_KEY);
        }
    }

    @Transactional
    public BigInteger claimFees(Address caller, AssetId asset) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            Address receiver = requireFeeReceiver(caller);
            return feeClaims.claim(FeePool.VAULT, custody, receiver, AssetId.orNative(asset));
        }
    }

    @Transactional
    public Map<AssetId, BigInteger> claimFeesMultiple(Address caller, List<AssetId> assets) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            Address receiver = requireFeeReceiver(caller);
            return feeClaims.claimEach(FeePool.VAULT, custody, receiver, assets.stream().map(AssetId::orNative).toList());
        }
    }

    @Transactional
    public BigInteger claimNativeFees(Address caller) {
        return claimFees(caller, AssetId.NATIVE);
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(String handle, AssetId asset) {
        return balanceStore.balanceOf(HandleHash.of(handle), AssetId.orNative(asset));
    }

    @Transactional(readOnly = true)
    public Map<AssetId, BigInteger> balancesOf(String handle, List<AssetId> assets) {
        String identityHash = HandleHash.of(handle);
        Map<AssetId, BigInteger> balances = new LinkedHashMap<>();
        for (AssetId asset : assets) {
            AssetId resolvedAsset = AssetId.orNative(asset);
            balances.put(resolvedAsset, balanceStore.balanceOf(identityHash, resolvedAsset));
        }
        return balances;
    }

    @Transactional(readOnly = true)
    public BigInteger accumulatedFees(AssetId asset) {
        return feePoolStore.balance(FeePool.VAULT, AssetId.orNative(asset));
    }

    @Transactional(readOnly = true)
    public ComponentSettings settings() {
        return settingsStore.load(ProtocolComponent.VAULT);
    }

    public int feeRate() {
        return settings().getFeeRateBps();
    }

    @Transactional
    public ComponentSettings setFeeRate(Address caller, int feeRateBps) {
        return administrator.setFeeRate(ProtocolComponent.VAULT, caller, feeRateBps);
    }

    @Transactional
    public ComponentSettings setFeeReceiver(Address caller, Address feeReceiver) {
        return administrator.setFeeReceiver(ProtocolComponent.VAULT, caller, feeReceiver);
    }

    @Transactional
    public ComponentSettings transferOwnership(Address caller, Address newOwner) {
        return administrator.transferOwnership(ProtocolComponent.VAULT, caller, newOwner);
    }

    /**
     * Zeroes the entry, accrues the fee and only then sends the net amount.
     *
     * @return empty if the entry was already zero; nothing changes in that case
     */
    private Optional<WithdrawalResult> drainTo(Address recipient, String handle, String identityHash, AssetId asset) {
        BigInteger gross = balanceStore.drain(identityHash, asset);
        if (gross.signum() == 0) {
            return Optional.empty();
        }

        int feeRateBps = settingsStore.load(ProtocolComponent.VAULT).getFeeRateBps();
        BigInteger fee = BasisPoints.portion(gross, feeRateBps);
        BigInteger net = gross.subtract(fee);
        feePoolStore.accrue(FeePool.VAULT, asset, fee);
        metrics.recordFeeAccrued(FeePool.VAULT, asset, fee);

        custody.pay(asset, recipient, net);

        outboxService.record(new WithdrawnEvent(UUID.randomUUID(), handle, identityHash, recipient,
            asset, gross, net, fee, Instant.now()));
        metrics.recordVaultOperation("withdraw", asset, "success");

        return Optional.of(new WithdrawalResult(handle, identityHash, recipient, asset, gross, net, fee));
    }

    private void requireHandleOwner(Address caller, String handle) {
        Optional<Address> owner = identityLookup.resolve(handle);
        if (owner.isEmpty() || !owner.get().equals(caller)) {
            throw ProtocolException.unauthorized("Caller does not own this handle");
        }
    }

    private Address requireFeeReceiver(Address caller) {
        ComponentSettings settings = settingsStore.load(ProtocolComponent.VAULT);
        if (!settings.isFeeReceiver(caller)) {
            log.warn("Rejected vault fee claim by {}", caller);
            throw ProtocolException.unauthorized("Only the vault fee receiver may claim vault fees");
        }
        return settings.getFeeReceiver();
    }
}
