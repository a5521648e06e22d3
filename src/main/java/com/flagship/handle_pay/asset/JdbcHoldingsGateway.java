package com.flagship.handle_pay.asset;

import com.flagship.handle_pay.error.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Custody model backed by the {@code asset_holdings} table.
 *
 * Each row is the amount of one asset held by one address. A move is a guarded
 * decrement of the source row followed by an upsert of the destination row; the
 * decrement only matches when the source holds enough, so holdings never go
 * negative. Runs inside the caller's transaction (MANDATORY).
 */
@Component
@Slf4j
public class JdbcHoldingsGateway implements AssetTransferGateway {

    private final JdbcTemplate jdbcTemplate;

    public JdbcHoldingsGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void collectValue(Address from, Address custody, BigInteger amount) {
        if (!move(AssetId.NATIVE, from, custody, amount)) {
            throw ProtocolException.transferFailed(
                String.format("Attached value %s exceeds native holdings of %s", amount, from));
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean sendValue(Address custody, Address to, BigInteger amount) {
        boolean moved = move(AssetId.NATIVE, custody, to, amount);
        if (!moved) {
            log.warn("Native send failed: from={}, to={}, amount={}", custody, to, amount);
        }
        return moved;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pullFrom(AssetId token, Address from, Address custody, BigInteger amount) {
        if (!move(token, from, custody, amount)) {
            throw ProtocolException.transferFailed(
                String.format("Token pull of %s %s from %s failed", amount, token, from));
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pushTo(AssetId token, Address custody, Address to, BigInteger amount) {
        if (!move(token, custody, to, amount)) {
            throw ProtocolException.transferFailed(
                String.format("Token push of %s %s to %s failed", amount, token, to));
        }
    }

    @Override
    public BigInteger balanceOf(AssetId asset, Address holder) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM asset_holdings WHERE holder = ? AND asset = ?",
            BigDecimal.class,
            holder.getValue(),
            asset.toString()
        );
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigIntegerExact();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public BigInteger lockedBalanceOf(AssetId asset, Address holder) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM asset_holdings WHERE holder = ? AND asset = ? FOR UPDATE",
            BigDecimal.class,
            holder.getValue(),
            asset.toString()
        );
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigIntegerExact();
    }

    private boolean move(AssetId asset, Address from, Address to, BigInteger amount) {
        if (amount.signum() == 0) {
            return true;
        }
        if (to.isZero()) {
            return false;
        }

        BigDecimal value = new BigDecimal(amount);
        int debited = jdbcTemplate.update(
            "UPDATE asset_holdings SET amount = amount - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE holder = ? AND asset = ? AND amount >= ?",
            value,
            from.getValue(),
            asset.toString(),
            value
        );
        if (debited == 0) {
            return false;
        }

        jdbcTemplate.update(
            "INSERT INTO asset_holdings (holder, asset, amount, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (holder, asset) DO UPDATE SET amount = asset_holdings.amount + EXCLUDED.amount, " +
            "updated_at = CURRENT_TIMESTAMP",
            to.getValue(),
            asset.toString(),
            value
        );
        log.debug("Moved {} of {} from {} to {}", amount, asset, from, to);
        return true;
    }
}
