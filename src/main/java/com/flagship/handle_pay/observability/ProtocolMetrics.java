package com.flagship.handle_pay.observability;

import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.fees.FeePool;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Centralized metrics for protocol operations.
 *
 * Metrics exposed:
 * - protocol.transfers: transfers by route, asset kind and outcome
 * - protocol.vault.operations: deposits, withdrawals and claims by outcome
 * - protocol.fees.accrued: fee units accrued per pool (as a counter of units)
 * - protocol.rejections: rejected calls by error code
 * - protocol.latency: operation latency
 *
 * Amount counters use doubles and lose precision above 2^53 units; they are for
 * dashboards, never for reconciliation.
 */
@Component
public class ProtocolMetrics {

    private final MeterRegistry registry;

    public ProtocolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransfer(String route, AssetId asset, String status) {
        registry.counter("protocol.transfers",
                "route", sanitizeTag(route),
                "asset_kind", asset.kind(),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordVaultOperation(String operation, AssetId asset, String status) {
        registry.counter("protocol.vault.operations",
                "operation", sanitizeTag(operation),
                "asset_kind", asset.kind(),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordFeeAccrued(FeePool pool, AssetId asset, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        registry.counter("protocol.fees.accrued",
                "pool", pool.name().toLowerCase(),
                "asset_kind", asset.kind()
        ).increment(amount.doubleValue());
    }

    public void recordFeeClaim(String claimant, AssetId asset) {
        registry.counter("protocol.fees.claims",
                "claimant", sanitizeTag(claimant),
                "asset_kind", asset.kind()
        ).increment();
    }

    public void recordRejection(String operation, String errorCode) {
        registry.counter("protocol.rejections",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("protocol.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
