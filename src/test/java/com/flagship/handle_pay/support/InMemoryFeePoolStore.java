package com.flagship.handle_pay.support;

import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.fees.FeePool;
import com.flagship.handle_pay.fees.FeePoolStore;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryFeePoolStore implements FeePoolStore, Snapshottable<Map<String, BigInteger>> {

    private Map<String, BigInteger> pools = new HashMap<>();

    @Override
    public void accrue(FeePool pool, AssetId asset, BigInteger amount) {
        pools.merge(key(pool, asset), amount, BigInteger::add);
    }

    @Override
    public BigInteger drain(FeePool pool, AssetId asset) {
        BigInteger previous = pools.getOrDefault(key(pool, asset), BigInteger.ZERO);
        pools.put(key(pool, asset), BigInteger.ZERO);
        return previous;
    }

    @Override
    public BigInteger balance(FeePool pool, AssetId asset) {
        return pools.getOrDefault(key(pool, asset), BigInteger.ZERO);
    }

    @Override
    public Map<String, BigInteger> snapshot() {
        return new HashMap<>(pools);
    }

    @Override
    public void restore(Map<String, BigInteger> snapshot) {
        pools = new HashMap<>(snapshot);
    }

    private static String key(FeePool pool, AssetId asset) {
        return pool + "/" + asset;
    }
}
