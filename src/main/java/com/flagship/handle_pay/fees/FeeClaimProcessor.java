package com.flagship.handle_pay.fees;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.CustodyAccount;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.FeesClaimedEvent;
import com.flagship.handle_pay.observability.ProtocolMetrics;
import com.flagship.handle_pay.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drains a fee pool to its receiver. Shared by the dispatcher and the vault,
 * which each check the caller and hold their own guard before calling in.
 *
 * The pool is zeroed before value leaves custody.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeeClaimProcessor {

    private final FeePoolStore feePoolStore;
    private final OutboxService outboxService;
    private final ProtocolMetrics metrics;

    /**
     * @throws ProtocolException NOTHING_TO_CLAIM if the pool holds nothing for {@code asset}
     */
    public BigInteger claim(FeePool pool, CustodyAccount custody, Address receiver, AssetId asset) {
        BigInteger amount = feePoolStore.drain(pool, asset);
        if (amount.signum() == 0) {
            throw new ProtocolException(ProtocolError.NOTHING_TO_CLAIM,
                String.format("No %s fees accumulated for asset %s", pool, asset));
        }
        payOut(pool, custody, receiver, asset, amount);
        return amount;
    }

    /**
     * Claims every listed asset, skipping empty pools.
     *
     * @return amounts claimed per asset, in request order; empty pools are absent
     */
    public Map<AssetId, BigInteger> claimEach(FeePool pool, CustodyAccount custody, Address receiver,
                                              List<AssetId> assets) {
        Map<AssetId, BigInteger> claimed = new LinkedHashMap<>();
        for (AssetId asset : assets) {
            BigInteger amount = feePoolStore.drain(pool, asset);
            if (amount.signum() == 0) {
                log.debug("Skipping empty {} fee pool for asset {}", pool, asset);
                continue;
            }
            payOut(pool, custody, receiver, asset, amount);
            claimed.merge(asset, amount, BigInteger::add);
        }
        return claimed;
    }

    private void payOut(FeePool pool, CustodyAccount custody, Address receiver, AssetId asset, BigInteger amount) {
        custody.pay(asset, receiver, amount);
        outboxService.record(new FeesClaimedEvent(UUID.randomUUID(), pool, receiver, asset, amount, Instant.now()));
        metrics.recordFeeClaim(pool.name().toLowerCase(), asset);
        log.info("Claimed {} fees: asset={}, amount={}, receiver={}", pool, asset, amount, receiver);
    }
}
