package com.flagship.handle_pay.fees;

import com.flagship.handle_pay.asset.AssetId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * {@code fee_pools} table keyed by (pool, asset).
 */
@Repository
@Slf4j
public class JdbcFeePoolStore implements FeePoolStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcFeePoolStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void accrue(FeePool pool, AssetId asset, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        jdbcTemplate.update(
            "INSERT INTO fee_pools (pool, asset, amount, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (pool, asset) DO UPDATE SET amount = fee_pools.amount + EXCLUDED.amount, " +
            "updated_at = CURRENT_TIMESTAMP",
            pool.name(),
            asset.toString(),
            new BigDecimal(amount)
        );
        log.debug("Accrued {} of {} to pool {}", amount, asset, pool);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger drain(FeePool pool, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM fee_pools WHERE pool = ? AND asset = ? FOR UPDATE",
            BigDecimal.class,
            pool.name(),
            asset.toString()
        );
        if (rows.isEmpty() || rows.get(0).signum() == 0) {
            return BigInteger.ZERO;
        }
        jdbcTemplate.update(
            "UPDATE fee_pools SET amount = 0, updated_at = CURRENT_TIMESTAMP WHERE pool = ? AND asset = ?",
            pool.name(),
            asset.toString()
        );
        return rows.get(0).toBigIntegerExact();
    }

    @Override
    public BigInteger balance(FeePool pool, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM fee_pools WHERE pool = ? AND asset = ?",
            BigDecimal.class,
            pool.name(),
            asset.toString()
        );
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigIntegerExact();
    }
}
