package com.flagship.handle_pay.distribution;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.BasisPoints;
import com.flagship.handle_pay.asset.CustodyAccount;
import com.flagship.handle_pay.dispatch.TransferDispatcher;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.ShareClaimedEvent;
import com.flagship.handle_pay.guard.ReentrancyGuard;
import com.flagship.handle_pay.observability.ProtocolMetrics;
import com.flagship.handle_pay.outbox.OutboxService;
import com.flagship.handle_pay.vault.EscrowVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Pulls accumulated protocol fees into its own custody and splits them between
 * two stakeholders at fixed basis-point shares.
 *
 * Shares are computed against whatever the distributor holds at claim time, not
 * against a per-stakeholder ledger. Claim order therefore affects the exact
 * amounts when claims interleave with new pulls.
 *
 * The custody address must be configured as the fee receiver of the dispatcher
 * and the vault for the pulls to be accepted.
 */
@Slf4j
public class FeeDistributor {

    private final CustodyAccount custody;
    private final Address admin;
    private final Stakeholder first;
    private final Stakeholder second;
    private final TransferDispatcher dispatcher;
    private final EscrowVault vault;
    private final OutboxService outboxService;
    private final ProtocolMetrics metrics;
    private final ReentrancyGuard guard = new ReentrancyGuard("distributor");

    public FeeDistributor(CustodyAccount custody,
                          Address admin,
                          Stakeholder first,
                          Stakeholder second,
                          TransferDispatcher dispatcher,
                          EscrowVault vault,
                          OutboxService outboxService,
                          ProtocolMetrics metrics) {
        if (first.getShareBps() < 0 || second.getShareBps() < 0
                || first.getShareBps() + second.getShareBps() != BasisPoints.DENOMINATOR) {
            throw new IllegalArgumentException(String.format(
                "Stakeholder shares must be non-negative and sum to %d bps, got %d + %d",
                BasisPoints.DENOMINATOR, first.getShareBps(), second.getShareBps()));
        }
        first.getAddress().requireNonZero("Stakeholder 1");
        second.getAddress().requireNonZero("Stakeholder 2");
        if (first.getAddress().equals(second.getAddress())) {
            throw new IllegalArgumentException("Stakeholders must be distinct addresses");
        }
        this.custody = custody;
        this.admin = admin.requireNonZero("Distributor admin");
        this.first = first;
        this.second = second;
        this.dispatcher = dispatcher;
        this.vault = vault;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    public Address getCustodyAddress() {
        return custody.getAddress();
    }

    public List<Stakeholder> stakeholders() {
        return List.of(first, second);
    }

    /**
     * @throws ProtocolException UNAUTHORIZED unless the caller is a stakeholder or the admin,
     *                           NOTHING_TO_CLAIM if the dispatcher pool is empty
     */
    @Transactional
    public BigInteger pullFromDispatcher(Address caller, AssetId asset) {
        AssetId resolvedAsset = AssetId.orNative(asset);
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            requirePuller(caller);
            if (dispatcher.accumulatedFees(resolvedAsset).signum() == 0) {
                throw new ProtocolException(ProtocolError.NOTHING_TO_CLAIM,
                    "No dispatcher fees accumulated for asset " + resolvedAsset);
            }
            BigInteger pulled = dispatcher.claimFees(custody.getAddress(), resolvedAsset);
            log.info("Pulled dispatcher fees into distributor: asset={}, amount={}", resolvedAsset, pulled);
            return pulled;
        }
    }

    /**
     * Best effort per asset: empty dispatcher pools are skipped.
     */
    @Transactional
    public Map<AssetId, BigInteger> pullFromDispatcherMultiple(Address caller, List<AssetId> assets) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            requirePuller(caller);
            Map<AssetId, BigInteger> pulled = dispatcher.claimFeesMultiple(custody.getAddress(), assets);
            log.info("Pulled dispatcher fees into distributor: assetsRequested={}, assetsPulled={}",
                assets.size(), pulled.size());
            return pulled;
        }
    }

    @Transactional
    public BigInteger pullFromVault(Address caller, AssetId asset) {
        AssetId resolvedAsset = AssetId.orNative(asset);
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            requirePuller(caller);
            if (vault.accumulatedFees(resolvedAsset).signum() == 0) {
                throw new ProtocolException(ProtocolError.NOTHING_TO_CLAIM,
                    "No vault fees accumulated for asset " + resolvedAsset);
            }
            BigInteger pulled = vault.claimFees(custody.getAddress(), resolvedAsset);
            log.info("Pulled vault fees into distributor: asset={}, amount={}", resolvedAsset, pulled);
            return pulled;
        }
    }

    @Transactional
    public Map<AssetId, BigInteger> pullFromVaultMultiple(Address caller, List<AssetId> assets) {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            requirePuller(caller);
            Map<AssetId, BigInteger> pulled = vault.claimFeesMultiple(custody.getAddress(), assets);
            log.info("Pulled vault fees into distributor: assetsRequested={}, assetsPulled={}",
                assets.size(), pulled.size());
            return pulled;
        }
    }

    /**
     * Pays the caller its share of the distributor's current holdings of {@code asset}.
     *
     * @throws ProtocolException UNAUTHORIZED unless the caller is a stakeholder,
     *                           NOTHING_TO_CLAIM if the share rounds to zero
     */
    @Transactional
    public BigInteger claimShare(Address caller, AssetId asset) {
        AssetId resolvedAsset = AssetId.orNative(asset);
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            Stakeholder stakeholder = findStakeholder(caller)
                .orElseThrow(() -> {
                    log.warn("Rejected share claim by non-stakeholder {}", caller);
                    return ProtocolException.unauthorized("Only stakeholders may claim shares");
                });

            // the guard is released before commit; the row lock covers the gap
            BigInteger held = custody.heldForUpdate(resolvedAsset);
            BigInteger share = BasisPoints.portion(held, stakeholder.getShareBps());
            if (share.signum() == 0) {
                throw new ProtocolException(ProtocolError.NOTHING_TO_CLAIM,
                    "Nothing to claim for asset " + resolvedAsset);
            }

            custody.pay(resolvedAsset, stakeholder.getAddress(), share);

            outboxService.record(new ShareClaimedEvent(UUID.randomUUID(), stakeholder.getAddress(), resolvedAsset,
                held, stakeholder.getShareBps(), share, Instant.now()));
            metrics.recordFeeClaim("stakeholder", resolvedAsset);
            log.info("Share claimed: stakeholder={}, asset={}, heldBefore={}, shareBps={}, amount={}",
                stakeholder.getAddress(), resolvedAsset, held, stakeholder.getShareBps(), share);

            return share;

        } catch (ProtocolException e) {
            metrics.recordRejection("claim_share", e.getError().name());
            throw e;
        }
    }

    public BigInteger heldBalance(AssetId asset) {
        return custody.held(AssetId.orNative(asset));
    }

    /**
     * What {@code address} would receive if it claimed now; zero for non-stakeholders.
     */
    public BigInteger pendingShare(Address address, AssetId asset) {
        return findStakeholder(address)
            .map(stakeholder -> BasisPoints.portion(heldBalance(asset), stakeholder.getShareBps()))
            .orElse(BigInteger.ZERO);
    }

    private Optional<Stakeholder> findStakeholder(Address address) {
        if (first.getAddress().equals(address)) {
            return Optional.of(first);
        }
        if (second.getAddress().equals(address)) {
            return Optional.of(second);
        }
        return Optional.empty();
    }

    private void requirePuller(Address caller) {
        if (!admin.equals(caller) && findStakeholder(caller).isEmpty()) {
            log.warn("Rejected fee pull by {}", caller);
            throw ProtocolException.unauthorized("Only stakeholders or the distributor admin may pull fees");
        }
    }
}
