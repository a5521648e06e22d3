package com.flagship.handle_pay.integration;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.JdbcHoldingsGateway;
import com.flagship.handle_pay.fees.FeePool;
import com.flagship.handle_pay.fees.FeePoolStore;
import com.flagship.handle_pay.identity.HandleHash;
import com.flagship.handle_pay.identity.IdentityLookup;
import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import com.flagship.handle_pay.settings.SettingsStore;
import com.flagship.handle_pay.vault.VaultBalanceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.flagship.handle_pay.support.TestAddresses.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JDBC stores and the holdings gateway against a real PostgreSQL.
 *
 * Verifies:
 * - NUMERIC(78, 0) holds full uint256 values
 * - drain returns and zeroes an entry, absent entries read as zero
 * - guarded holdings moves never go negative
 * - write operations refuse to run outside a transaction
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PersistenceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("handle_pay_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final AssetId TOKEN_ASSET = AssetId.token(TOKEN);

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private VaultBalanceStore balanceStore;

    @Autowired
    private FeePoolStore feePoolStore;

    @Autowired
    private SettingsStore settingsStore;

    @Autowired
    private JdbcHoldingsGateway gateway;

    @Autowired
    private IdentityLookup identityLookup;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("TRUNCATE asset_holdings, handle_registrations, vault_balances, fee_pools");
    }

    @Test
    @DisplayName("Vault entries credit, drain to zero and sum per asset")
    void testVaultBalanceStore() {
        String alice = HandleHash.of("alice");
        String bob = HandleHash.of("bob");

        BigInteger afterSecondCredit = transactionTemplate.execute(status -> {
            balanceStore.credit(alice, AssetId.NATIVE, units(1));
            balanceStore.credit(bob, AssetId.NATIVE, units(2));
            balanceStore.credit(alice, TOKEN_ASSET, units(7));
            return balanceStore.credit(alice, AssetId.NATIVE, units(3));
        });

        assertEquals(units(4), afterSecondCredit);
        assertEquals(units(6), balanceStore.totalOf(AssetId.NATIVE));
        assertEquals(units(7), balanceStore.totalOf(TOKEN_ASSET));

        BigInteger drained = transactionTemplate.execute(status -> balanceStore.drain(alice, AssetId.NATIVE));
        assertEquals(units(4), drained);
        assertEquals(BigInteger.ZERO, balanceStore.balanceOf(alice, AssetId.NATIVE));
        assertEquals(units(7), balanceStore.balanceOf(alice, TOKEN_ASSET));

        BigInteger drainedAgain = transactionTemplate.execute(status -> balanceStore.drain(alice, AssetId.NATIVE));
        assertEquals(BigInteger.ZERO, drainedAgain);
        assertEquals(BigInteger.ZERO, balanceStore.balanceOf(HandleHash.of("nobody"), AssetId.NATIVE));
    }

    @Test
    @DisplayName("uint256 maximum survives a round trip through NUMERIC(78, 0)")
    void testFullWidthAmounts() {
        BigInteger max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        String hash = HandleHash.of("whale");

        transactionTemplate.executeWithoutResult(status -> balanceStore.credit(hash, TOKEN_ASSET, max));

        assertEquals(max, balanceStore.balanceOf(hash, TOKEN_ASSET));
    }

    @Test
    @DisplayName("Fee pools accrue per pool and asset and drain to zero")
    void testFeePoolStore() {
        transactionTemplate.executeWithoutResult(status -> {
            feePoolStore.accrue(FeePool.DISPATCHER, AssetId.NATIVE, BigInteger.valueOf(5));
            feePoolStore.accrue(FeePool.DISPATCHER, AssetId.NATIVE, BigInteger.valueOf(7));
            feePoolStore.accrue(FeePool.VAULT, AssetId.NATIVE, BigInteger.valueOf(1));
            feePoolStore.accrue(FeePool.DISPATCHER, TOKEN_ASSET, BigInteger.ZERO);
        });

        assertEquals(BigInteger.valueOf(12), feePoolStore.balance(FeePool.DISPATCHER, AssetId.NATIVE));
        assertEquals(BigInteger.ONE, feePoolStore.balance(FeePool.VAULT, AssetId.NATIVE));
        assertEquals(BigInteger.ZERO, feePoolStore.balance(FeePool.DISPATCHER, TOKEN_ASSET));

        BigInteger drained = transactionTemplate.execute(status -> feePoolStore.drain(FeePool.DISPATCHER, AssetId.NATIVE));
        assertEquals(BigInteger.valueOf(12), drained);
        assertEquals(BigInteger.ZERO, feePoolStore.balance(FeePool.DISPATCHER, AssetId.NATIVE));
        assertEquals(BigInteger.ONE, feePoolStore.balance(FeePool.VAULT, AssetId.NATIVE));
    }

    @Test
    @DisplayName("Store writes require a surrounding transaction")
    void testMandatoryTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> balanceStore.credit(HandleHash.of("alice"), AssetId.NATIVE, BigInteger.ONE));
        assertThrows(IllegalTransactionStateException.class,
            () -> feePoolStore.accrue(FeePool.VAULT, AssetId.NATIVE, BigInteger.ONE));
    }

    @Test
    @DisplayName("Holdings moves are guarded: insufficient or zero-address moves fail and change nothing")
    void testHoldingsGateway() {
        fund(SENDER, AssetId.NATIVE, units(5));

        boolean sent = Boolean.TRUE.equals(transactionTemplate.execute(
            status -> gateway.sendValue(SENDER, ALICE, units(2))));
        assertTrue(sent);
        assertEquals(units(3), gateway.balanceOf(AssetId.NATIVE, SENDER));
        assertEquals(units(2), gateway.balanceOf(AssetId.NATIVE, ALICE));

        boolean overdrawn = Boolean.TRUE.equals(transactionTemplate.execute(
            status -> gateway.sendValue(SENDER, ALICE, units(4))));
        assertFalse(overdrawn);
        assertEquals(units(3), gateway.balanceOf(AssetId.NATIVE, SENDER));

        boolean toZero = Boolean.TRUE.equals(transactionTemplate.execute(
            status -> gateway.sendValue(SENDER, Address.ZERO, units(1))));
        assertFalse(toZero);

        assertThrows(RuntimeException.class, () -> transactionTemplate.executeWithoutResult(
            status -> gateway.pullFrom(TOKEN_ASSET, SENDER, VAULT_CUSTODY, BigInteger.ONE)));
        assertEquals(BigInteger.ZERO, gateway.balanceOf(TOKEN_ASSET, VAULT_CUSTODY));
    }

    @Test
    @DisplayName("Holdings never go negative even when written directly")
    void testHoldingsCheckConstraint() {
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "INSERT INTO asset_holdings (holder, asset, amount) VALUES (?, ?, ?)",
            SENDER.getValue(), AssetId.NATIVE.toString(), BigDecimal.valueOf(-1)));
    }

    @Test
    @DisplayName("Registry rows resolve handles; the zero address means unregistered")
    void testIdentityLookup() {
        jdbcTemplate.update("INSERT INTO handle_registrations (handle, owner) VALUES (?, ?)", "alice", ALICE.getValue());
        jdbcTemplate.update("INSERT INTO handle_registrations (handle, owner) VALUES (?, ?)", "ghost", Address.ZERO.getValue());

        assertEquals(ALICE, identityLookup.resolve("alice").orElseThrow());
        assertTrue(identityLookup.resolve("ghost").isEmpty());
        assertTrue(identityLookup.resolve("nobody").isEmpty());
    }

    @Test
    @DisplayName("Settings are seeded once at startup and saved changes persist")
    void testSettingsStore() {
        ComponentSettings vault = settingsStore.load(ProtocolComponent.VAULT);
        assertEquals(OWNER, vault.getOwner());
        assertEquals(DISTRIBUTOR_CUSTODY, vault.getFeeReceiver());

        assertFalse(settingsStore.initializeIfAbsent(
            ComponentSettings.initial(ProtocolComponent.VAULT, ALICE, 0, ALICE)));

        ComponentSettings original = settingsStore.load(ProtocolComponent.DISPATCHER);
        try {
            settingsStore.save(original.withFeeRate(250));
            assertEquals(250, settingsStore.load(ProtocolComponent.DISPATCHER).getFeeRateBps());
        } finally {
            settingsStore.save(original);
        }
    }

    private void fund(Address holder, AssetId asset, BigInteger amount) {
        jdbcTemplate.update("INSERT INTO asset_holdings (holder, asset, amount) VALUES (?, ?, ?)",
            holder.getValue(), asset.toString(), new BigDecimal(amount));
    }
}
