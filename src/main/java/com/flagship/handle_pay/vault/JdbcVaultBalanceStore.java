package com.flagship.handle_pay.vault;

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
 * {@code vault_balances} table. Writes require the caller's transaction so a
 * failed payout rolls the zeroing back with it.
 */
@Repository
@Slf4j
public class JdbcVaultBalanceStore implements VaultBalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcVaultBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger credit(String identityHash, AssetId asset, BigInteger amount) {
        BigDecimal balanceAfter = jdbcTemplate.queryForObject(
            "INSERT INTO vault_balances (identity_hash, asset, amount, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (identity_hash, asset) DO UPDATE SET amount = vault_balances.amount + EXCLUDED.amount, " +
            "updated_at = CURRENT_TIMESTAMP RETURNING amount",
            BigDecimal.class,
            identityHash,
            asset.toString(),
            new BigDecimal(amount)
        );
        log.debug("Credited {} of {} to {}", amount, asset, identityHash);
        return balanceAfter.toBigIntegerExact();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger drain(String identityHash, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM vault_balances WHERE identity_hash = ? AND asset = ? FOR UPDATE",
            BigDecimal.class,
            identityHash,
            asset.toString()
        );
        if (rows.isEmpty() || rows.get(0).signum() == 0) {
            return BigInteger.ZERO;
        }
        jdbcTemplate.update(
            "UPDATE vault_balances SET amount = 0, updated_at = CURRENT_TIMESTAMP " +
            "WHERE identity_hash = ? AND asset = ?",
            identityHash,
            asset.toString()
        );
        log.debug("Drained {} of {} from {}", rows.get(0), asset, identityHash);
        return rows.get(0).toBigIntegerExact();
    }

    @Override
    public BigInteger balanceOf(String identityHash, AssetId asset) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM vault_balances WHERE identity_hash = ? AND asset = ?",
            BigDecimal.class,
            identityHash,
            asset.toString()
        );
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigIntegerExact();
    }

    @Override
    public BigInteger totalOf(AssetId asset) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM vault_balances WHERE asset = ?",
            BigDecimal.class,
            asset.toString()
        );
        return total != null ? total.toBigIntegerExact() : BigInteger.ZERO;
    }
}
