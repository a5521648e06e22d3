package com.flagship.handle_pay.support;

import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.vault.VaultBalanceStore;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryVaultBalanceStore implements VaultBalanceStore, Snapshottable<Map<String, BigInteger>> {

    private Map<String, BigInteger> balances = new HashMap<>();

    @Override
    public BigInteger credit(String identityHash, AssetId asset, BigInteger amount) {
        return balances.merge(key(identityHash, asset), amount, BigInteger::add);
    }

    @Override
    public BigInteger drain(String identityHash, AssetId asset) {
        BigInteger previous = balances.getOrDefault(key(identityHash, asset), BigInteger.ZERO);
        if (previous.signum() > 0) {
            balances.put(key(identityHash, asset), BigInteger.ZERO);
        }
        return previous;
    }

    @Override
    public BigInteger balanceOf(String identityHash, AssetId asset) {
        return balances.getOrDefault(key(identityHash, asset), BigInteger.ZERO);
    }

    @Override
    public BigInteger totalOf(AssetId asset) {
        String suffix = "/" + asset;
        return balances.entrySet().stream()
            .filter(entry -> entry.getKey().endsWith(suffix))
            .map(Map.Entry::getValue)
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    @Override
    public Map<String, BigInteger> snapshot() {
        return new HashMap<>(balances);
    }

    @Override
    public void restore(Map<String, BigInteger> snapshot) {
        balances = new HashMap<>(snapshot);
    }

    private static String key(String identityHash, AssetId asset) {
        return identityHash + "/" + asset;
    }
}
