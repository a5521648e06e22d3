package com.flagship.handle_pay.dispatch;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.Amounts;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.BasisPoints;
import com.flagship.handle_pay.asset.CustodyAccount;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.BatchTransferCompletedEvent;
import com.flagship.handle_pay.event.TransferCompletedEvent;
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
import com.flagship.handle_pay.vault.EscrowVault;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Routes value sent to a handle.
 *
 * A handle the registry resolves is paid immediately, net of the dispatcher fee,
 * which accrues to the DISPATCHER pool. An unregistered handle has the full
 * amount deposited into the {@link EscrowVault}; the vault charges its own fee
 * when the owner later withdraws.
 *
 * Key principles:
 * - One transaction per call: any failure (including a failed payout) rolls back
 *   every move and accrual made by the call
 * - Fees are accrued before value leaves custody
 * - Calls are serialized by this dispatcher's {@link ReentrancyGuard}
 * - Vault storage is only touched through the vault's deposit operations
 */
@Slf4j
public class TransferDispatcher {

    private final IdentityLookup identityLookup;
    private final EscrowVault vault;
    private final FeePoolStore feePoolStore;
    private final SettingsStore settingsStore;
    private final CustodyAccount custody;
    private final FeeClaimProcessor feeClaims;
    private final SettingsAdministrator administrator;
    private final OutboxService outboxService;
    private final ProtocolMetrics metrics;
    private final ReentrancyGuard guard = new ReentrancyGuard("dispatcher");

    public TransferDispatcher(IdentityLookup identityLookup,
                              EscrowVault vault,
                              FeePoolStore feePoolStore,
                              SettingsStore settingsStore,
                              CustodyAccount custody,
                              FeeClaimProcessor feeClaims,
                              SettingsAdministrator administrator,
                              OutboxService outboxService,
                              ProtocolMetrics metrics) {
        this.identityLookup = identityLookup;
        this.vault = vault;
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
     * Sends {@code amount} to whoever owns {@code handle}, or escrows it if nobody does.
     *
     * For the native coin, {@code amount} is the value attached to the call. For a
     * token, {@code amount} units are pulled from the caller before routing.
     *
     * @param asset null or {@link AssetId#NATIVE} for the native coin
     * @throws ProtocolException INVALID_HANDLE, INVALID_AMOUNT, TRANSFER_FAILED or REENTRANT_CALL
     */
    @Transactional
    public TransferResult transfer(Address caller, String handle, BigInteger amount, AssetId asset) {
        long startTime = System.currentTimeMillis();
        AssetId resolvedAsset = AssetId.orNative(asset);

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            String identityHash = HandleHash.of(handle);
            Amounts.requirePositive(amount, "Transfer amount");
            MDC.put(CorrelationContext.HANDLE_HASH_MDC_KEY, identityHash);

            custody.receive(resolvedAsset, caller, amount);

            Optional<Address> owner = identityLookup.resolve(handle);
            TransferResult result = owner.isPresent()
                ? payDirect(caller, handle, identityHash, owner.get(), resolvedAsset, amount)
                : escrow(caller, handle, identityHash, resolvedAsset, amount);

            outboxService.record(TransferCompletedEvent.of(caller, handle, identityHash, result.getRecipient(),
                resolvedAsset, amount, result.getNetAmount(), result.getFee(), result.getRoute()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransfer(result.getRoute().name().toLowerCase(), resolvedAsset, "success");
            metrics.recordLatency("transfer", duration);
            log.info("Transfer completed: route={}, asset={}, amount={}, net={}, fee={}, duration={}ms",
                result.getRoute(), resolvedAsset, amount, result.getNetAmount(), result.getFee(), duration);

            return result;

        } catch (ProtocolException e) {
            metrics.recordTransfer("unknown", resolvedAsset, "rejected");
            metrics.recordRejection("transfer", e.getError().name());
            log.warn("Transfer rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransfer("unknown", resolvedAsset, "error");
            log.error("Transfer failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.HANDLE_HASH_MDC_KEY);
        }
    }

    /**
     * Pays a pre-split batch: direct recipients by address, unregistered
     * recipients into the vault in one batch deposit.
     *
     * The dispatcher fee is computed once on the direct total. Each direct
     * recipient receives its own amount scaled by {@code (10000 - rate) / 10000},
     * rounded down; the rounding dust accrues with the fee.
     *
     * @throws ProtocolException LENGTH_MISMATCH, EMPTY_BATCH, INVALID_AMOUNT, INVALID_ADDRESS,
     *                           INVALID_HANDLE, AMOUNT_MISMATCH or TRANSFER_FAILED
     */
    @Transactional
    public BatchTransferResult batchTransfer(Address caller, BatchTransferCommand command) {
        long startTime = System.currentTimeMillis();
        AssetId resolvedAsset = AssetId.orNative(command.getAsset());

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            List<String> handles = command.getUnregisteredHandles();
            List<BigInteger> vaultAmounts = command.getVaultAmounts();
            List<Address> recipients = command.getRegisteredAddresses();
            List<BigInteger> directAmounts = command.getDirectAmounts();

            validateBatchShape(handles, vaultAmounts, recipients, directAmounts);
            BigInteger escrowedTotal = Amounts.sum(vaultAmounts);
            BigInteger directTotal = Amounts.sum(directAmounts);
            BigInteger total = Amounts.addExact(escrowedTotal, directTotal);
            Amounts.requireAttachedValue(resolvedAsset, total, command.getAttachedValue());

            custody.receive(resolvedAsset, caller, total);

            int feeRateBps = settingsStore.load(ProtocolComponent.DISPATCHER).getFeeRateBps();
            List<BigInteger> nets = new ArrayList<>(directAmounts.size());
            BigInteger directPaid = BigInteger.ZERO;
            for (BigInteger amount : directAmounts) {
                BigInteger net = BasisPoints.complementPortion(amount, feeRateBps);
                nets.add(net);
                directPaid = directPaid.add(net);
            }
            BigInteger fee = directTotal.subtract(directPaid);
            feePoolStore.accrue(FeePool.DISPATCHER, resolvedAsset, fee);
            metrics.recordFeeAccrued(FeePool.DISPATCHER, resolvedAsset, fee);

            if (!handles.isEmpty()) {
                vault.batchDeposit(custody.getAddress(), handles, vaultAmounts, resolvedAsset,
                    resolvedAsset.isNative() ? escrowedTotal : null);
            }
            for (int i = 0; i < recipients.size(); i++) {
                custody.pay(resolvedAsset, recipients.get(i), nets.get(i));
            }

            UUID batchId = UUID.randomUUID();
            outboxService.record(new BatchTransferCompletedEvent(UUID.randomUUID(), batchId, caller, resolvedAsset,
                handles.size(), escrowedTotal, recipients.size(), directTotal, directPaid, fee, Instant.now()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransfer("batch", resolvedAsset, "success");
            metrics.recordLatency("batch_transfer", duration);
            log.info("Batch transfer completed: batchId={}, asset={}, escrowed={}x{}, direct={}x{}, fee={}, duration={}ms",
                batchId, resolvedAsset, handles.size(), escrowedTotal, recipients.size(), directTotal, fee, duration);

            return new BatchTransferResult(batchId, caller, resolvedAsset, escrowedTotal, directTotal,
                directPaid, fee, List.copyOf(nets));

        } catch (ProtocolException e) {
            metrics.recordTransfer("batch", resolvedAsset, "rejected");
            metrics.recordRejection("batch_transfer", e.getError().name());
            log.warn("Batch transfer rejected: code={}, reason={}", e.getError(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransfer("batch", resolvedAsset, "error");
            log.error("Batch transfer failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        }
    }

    /**
     * Drains the dispatcher pool for {@code asset} to the fee receiver.
     *
     * @throws ProtocolException UNAUTHORIZED unless the caller is the fee receiver,
     *                           NOTHING_TO_CLAIM if the pool is empty
     */
    @Transactional
    public BigInteger claimFees(Address caller, AssetId asset) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            Address receiver = requireFeeReceiver(caller);
            return feeClaims.claim(FeePool.DISPATCHER, custody, receiver, AssetId.orNative(asset));
        }
    }

    /**
     * Like {@link #claimFees} for several assets; empty pools are skipped.
     */
    @Transactional
    public Map<AssetId, BigInteger> claimFeesMultiple(Address caller, List<AssetId> assets) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            Address receiver = requireFeeReceiver(caller);
            return feeClaims.claimEach(FeePool.DISPATCHER, custody, receiver,
                assets.stream().map(AssetId::orNative).toList());
        }
    }

    @Transactional(readOnly = true)
    public FeeQuote quoteFee(BigInteger amount) {
        Amounts.requirePositive(amount, "Quoted amount");
        int feeRateBps = feeRate();
        BigInteger fee = BasisPoints.portion(amount, feeRateBps);
        return new FeeQuote(amount, feeRateBps, fee, amount.subtract(fee));
    }

    @Transactional(readOnly = true)
    public BigInteger accumulatedFees(AssetId asset) {
        return feePoolStore.balance(FeePool.DISPATCHER, AssetId.orNative(asset));
    }

    @Transactional(readOnly = true)
    public ComponentSettings settings() {
        return settingsStore.load(ProtocolComponent.DISPATCHER);
    }

    public int feeRate() {
        return settings().getFeeRateBps();
    }

    @Transactional
    public ComponentSettings setFeeRate(Address caller, int feeRateBps) {
        return administrator.setFeeRate(ProtocolComponent.DISPATCHER, caller, feeRateBps);
    }

    @Transactional
    public ComponentSettings setFeeReceiver(Address caller, Address feeReceiver) {
        return administrator.setFeeReceiver(ProtocolComponent.DISPATCHER, caller, feeReceiver);
    }

    @Transactional
    public ComponentSettings transferOwnership(Address caller, Address newOwner) {
        return administrator.transferOwnership(ProtocolComponent.DISPATCHER, caller, newOwner);
    }

    private TransferResult payDirect(Address caller, String handle, String identityHash, Address owner,
                                     AssetId asset, BigInteger amount) {
        int feeRateBps = settingsStore.load(ProtocolComponent.DISPATCHER).getFeeRateBps();
        BigInteger fee = BasisPoints.portion(amount, feeRateBps);
        BigInteger payout = amount.subtract(fee);

        feePoolStore.accrue(FeePool.DISPATCHER, asset, fee);
        metrics.recordFeeAccrued(FeePool.DISPATCHER, asset, fee);
        custody.pay(asset, owner, payout);

        return new TransferResult(TransferRoute.DIRECT, caller, handle, identityHash, owner,
            asset, amount, payout, fee);
    }

    private TransferResult escrow(Address caller, String handle, String identityHash,
                                  AssetId asset, BigInteger amount) {
        vault.deposit(custody.getAddress(), handle, amount, asset);
        return new TransferResult(TransferRoute.ESCROWED, caller, handle, identityHash, null,
            asset, amount, amount, BigInteger.ZERO);
    }

    private void validateBatchShape(List<String> handles, List<BigInteger> vaultAmounts,
                                    List<Address> recipients, List<BigInteger> directAmounts) {
        if (handles.size() != vaultAmounts.size()) {
            throw new ProtocolException(ProtocolError.LENGTH_MISMATCH,
                String.format("%d unregistered handles but %d vault amounts", handles.size(), vaultAmounts.size()));
        }
        if (recipients.size() != directAmounts.size()) {
            throw new ProtocolException(ProtocolError.LENGTH_MISMATCH,
                String.format("%d registered addresses but %d direct amounts", recipients.size(), directAmounts.size()));
        }
        if (handles.isEmpty() && recipients.isEmpty()) {
            throw new ProtocolException(ProtocolError.EMPTY_BATCH, "Batch transfer has no recipients");
        }
        handles.forEach(HandleHash::requireHandle);
        for (Address recipient : recipients) {
            if (recipient == null) {
                throw new ProtocolException(ProtocolError.INVALID_ADDRESS, "Registered address must not be null");
            }
            recipient.requireNonZero("Registered address");
        }
    }

    private Address requireFeeReceiver(Address caller) {
        ComponentSettings settings = settingsStore.load(ProtocolComponent.DISPATCHER);
        if (!settings.isFeeReceiver(caller)) {
            log.warn("Rejected dispatcher fee claim by {}", caller);
            throw ProtocolException.unauthorized("Only the dispatcher fee receiver may claim dispatcher fees");
        }
        return settings.getFeeReceiver();
    }
}
