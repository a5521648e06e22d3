package com.flagship.handle_pay.fees;

import com.flagship.handle_pay.asset.AssetId;

import java.math.BigInteger;

/**
 * Per-pool, per-asset accumulated fees. A pool only grows, except through
 * {@link #drain}, which zeroes it.
 */
public interface FeePoolStore {

    void accrue(FeePool pool, AssetId asset, BigInteger amount);

    /**
     * Zeroes the pool entry and returns what it held (zero if absent).
     */
    BigInteger drain(FeePool pool, AssetId asset);

    BigInteger balance(FeePool pool, AssetId asset);
}
