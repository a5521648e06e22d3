package com.flagship.handle_pay.vault;

import com.flagship.handle_pay.asset.AssetId;

import java.math.BigInteger;

/**
 * Balance entries keyed by (identity hash, asset).
 *
 * Absence means zero. Entries are never deleted: a drained entry stays at zero.
 */
public interface VaultBalanceStore {

    /**
     * Adds {@code amount} to the entry, creating it if needed.
     *
     * @return the balance after the credit
     */
    BigInteger credit(String identityHash, AssetId asset, BigInteger amount);

    /**
     * Sets the entry to zero and returns its previous balance.
     */
    BigInteger drain(String identityHash, AssetId asset);

    BigInteger balanceOf(String identityHash, AssetId asset);

    /**
     * Sum of all entries for an asset. Never exceeds the vault's custody holdings.
     */
    BigInteger totalOf(AssetId asset);
}
