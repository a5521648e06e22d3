package com.flagship.handle_pay.vault;

import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.event.BatchDepositedEvent;
import com.flagship.handle_pay.event.DepositedEvent;
import com.flagship.handle_pay.event.FeesClaimedEvent;
import com.flagship.handle_pay.event.WithdrawnEvent;
import com.flagship.handle_pay.identity.HandleHash;
import com.flagship.handle_pay.support.ProtocolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.flagship.handle_pay.support.TestAddresses.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Escrow vault behaviour over in-memory stores.
 *
 * Vault fee is 10% so rounding is easy to follow.
 */
class EscrowVaultTest {

    private static final AssetId TOKEN_ASSET = AssetId.token(TOKEN);

    private ProtocolFixture fixture;
    private EscrowVault vault;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        fixture = new ProtocolFixture(100, 1000);
        vault = fixture.vault;
        fixture.gateway.fund(SENDER, AssetId.NATIVE, units(100));
        fixture.gateway.fund(SENDER, TOKEN_ASSET, units(100));
    }

    @Test
    @DisplayName("Deposit for an unregistered handle, register, withdraw net of the 10% fee")
    void testDepositThenWithdrawAfterRegistration() {
        printTestHeader("Deposit -> register -> withdraw");

        // Given: one unit escrowed for "alice" before she has registered
        BigInteger balance = vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        assertEquals(units(1), balance);
        assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE));
        assertEquals(units(1), fixture.gateway.balanceOf(AssetId.NATIVE, VAULT_CUSTODY));

        // When: alice registers and withdraws
        fixture.identities.register("alice", ALICE);
        WithdrawalResult result = vault.withdraw(ALICE, "alice", AssetId.NATIVE);
        printOutput("Withdrawal", result);

        // Then: 0.9 reaches alice, 0.1 stays in custody as fee
        assertEquals(units(1), result.getGross());
        assertEquals(units(0, 90), result.getNet());
        assertEquals(units(0, 10), result.getFee());
        assertEquals(units(0, 90), fixture.gateway.balanceOf(AssetId.NATIVE, ALICE));
        assertEquals(BigInteger.ZERO, vault.balanceOf("alice", AssetId.NATIVE));
        assertEquals(units(0, 10), vault.accumulatedFees(AssetId.NATIVE));
        assertEquals(units(0, 10), fixture.gateway.balanceOf(AssetId.NATIVE, VAULT_CUSTODY));

        verify(fixture.outbox).record(any(DepositedEvent.class));
        verify(fixture.outbox).record(argThat(event -> event instanceof WithdrawnEvent withdrawn
            && withdrawn.getIdentityHash().equals(HandleHash.of("alice"))
            && withdrawn.getNet().equals(units(0, 90))));

        // And: a second withdrawal has nothing left
        ProtocolException e = assertThrows(ProtocolException.class,
            () -> vault.withdraw(ALICE, "alice", AssetId.NATIVE));
        assertEquals(ProtocolError.NOTHING_TO_WITHDRAW, e.getError());
        printSuccess("Escrowed value released once, net of fee");
    }

    @Test
    @DisplayName("Deposits accumulate per handle and asset")
    void testDepositsAccumulate() {
        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        vault.deposit(SENDER, "alice", units(2), AssetId.NATIVE);
        vault.deposit(SENDER, "alice", units(5), TOKEN_ASSET);

        assertEquals(units(3), vault.balanceOf("alice", null));
        assertEquals(units(5), vault.balanceOf("alice", TOKEN_ASSET));
        assertEquals(BigInteger.ZERO, vault.balanceOf("bob", AssetId.NATIVE));

        Map<AssetId, BigInteger> balances = vault.balancesOf("alice", List.of(AssetId.NATIVE, TOKEN_ASSET));
        assertEquals(List.of(AssetId.NATIVE, TOKEN_ASSET), List.copyOf(balances.keySet()));
        assertEquals(units(5), balances.get(TOKEN_ASSET));
    }

    @Test
    @DisplayName("Deposit rejects zero amounts and empty handles without moving value")
    void testDepositValidation() {
        ProtocolException zero = assertThrows(ProtocolException.class,
            () -> vault.deposit(SENDER, "alice", BigInteger.ZERO, AssetId.NATIVE));
        assertEquals(ProtocolError.INVALID_AMOUNT, zero.getError());

        ProtocolException empty = assertThrows(ProtocolException.class,
            () -> vault.deposit(SENDER, "", units(1), AssetId.NATIVE));
        assertEquals(ProtocolError.INVALID_HANDLE, empty.getError());

        assertEquals(units(100), fixture.gateway.balanceOf(AssetId.NATIVE, SENDER));
        verify(fixture.outbox, never()).record(any());
    }

    @Test
    @DisplayName("A whitespace-only handle is escrowed under its own key")
    void testWhitespaceHandleDeposit() {
        vault.deposit(SENDER, " ", units(1), AssetId.NATIVE);

        assertEquals(units(1), vault.balanceOf(" ", AssetId.NATIVE));
        assertEquals(BigInteger.ZERO, vault.balanceOf("  ", AssetId.NATIVE));
    }

    @Test
    @DisplayName("Token deposit fails with TRANSFER_FAILED when the sender cannot cover it")
    void testTokenDepositInsufficientHoldings() {
        ProtocolException e = assertThrows(ProtocolException.class,
            () -> vault.deposit(MALLORY, "alice", units(1), TOKEN_ASSET));

        assertEquals(ProtocolError.TRANSFER_FAILED, e.getError());
        assertEquals(BigInteger.ZERO, vault.balanceOf("alice", TOKEN_ASSET));
    }

    @Test
    @DisplayName("Batch deposit credits every handle from one native transfer")
    void testBatchDepositNative() {
        printTestHeader("Batch deposit (native)");

        BigInteger total = vault.batchDeposit(SENDER, List.of("alice", "bob", "alice"),
            List.of(units(1), units(2), units(3)), AssetId.NATIVE, units(6));

        assertEquals(units(6), total);
        assertEquals(units(4), vault.balanceOf("alice", AssetId.NATIVE));
        assertEquals(units(2), vault.balanceOf("bob", AssetId.NATIVE));
        assertEquals(units(94), fixture.gateway.balanceOf(AssetId.NATIVE, SENDER));
        verify(fixture.outbox).record(argThat(event -> event instanceof BatchDepositedEvent batch
            && batch.getCredits().size() == 3 && batch.getTotal().equals(units(6))));
        printSuccess("Three credits from a single custody receipt");
    }

    @Test
    @DisplayName("Batch deposit of a token pulls the sum once and refuses attached value")
    void testBatchDepositToken() {
        vault.batchDeposit(SENDER, List.of("alice", "bob"), List.of(units(1), units(2)), TOKEN_ASSET, null);

        assertEquals(units(97), fixture.gateway.balanceOf(TOKEN_ASSET, SENDER));
        assertEquals(units(3), fixture.gateway.balanceOf(TOKEN_ASSET, VAULT_CUSTODY));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> vault.batchDeposit(SENDER, List.of("alice"), List.of(units(1)), TOKEN_ASSET, units(1)));
        assertEquals(ProtocolError.AMOUNT_MISMATCH, e.getError());
    }

    @Test
    @DisplayName("Batch deposit rejects malformed batches before touching custody")
    void testBatchDepositValidation() {
        ProtocolException length = assertThrows(ProtocolException.class,
            () -> vault.batchDeposit(SENDER, List.of("alice", "bob"), List.of(units(1)), AssetId.NATIVE, units(1)));
        assertEquals(ProtocolError.LENGTH_MISMATCH, length.getError());

        ProtocolException empty = assertThrows(ProtocolException.class,
            () -> vault.batchDeposit(SENDER, List.of(), List.of(), AssetId.NATIVE, BigInteger.ZERO));
        assertEquals(ProtocolError.EMPTY_BATCH, empty.getError());

        ProtocolException mismatch = assertThrows(ProtocolException.class,
            () -> vault.batchDeposit(SENDER, List.of("alice", "bob"), List.of(units(1), units(2)),
                AssetId.NATIVE, units(2)));
        assertEquals(ProtocolError.AMOUNT_MISMATCH, mismatch.getError());

        ProtocolException zeroEntry = assertThrows(ProtocolException.class,
            () -> vault.batchDeposit(SENDER, List.of("alice", "bob"), List.of(units(1), BigInteger.ZERO),
                AssetId.NATIVE, units(1)));
        assertEquals(ProtocolError.INVALID_AMOUNT, zeroEntry.getError());

        assertEquals(units(100), fixture.gateway.balanceOf(AssetId.NATIVE, SENDER));
        assertEquals(BigInteger.ZERO, vault.balanceOf("alice", AssetId.NATIVE));
    }

    @Test
    @DisplayName("Only the address the handle currently resolves to may withdraw")
    void testWithdrawAuthorization() {
        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);

        // Unregistered handle
        ProtocolException unregistered = assertThrows(ProtocolException.class,
            () -> vault.withdraw(ALICE, "alice", AssetId.NATIVE));
        assertEquals(ProtocolError.UNAUTHORIZED, unregistered.getError());

        // Someone else
        fixture.identities.register("alice", ALICE);
        ProtocolException stranger = assertThrows(ProtocolException.class,
            () -> vault.withdraw(MALLORY, "alice", AssetId.NATIVE));
        assertEquals(ProtocolError.UNAUTHORIZED, stranger.getError());

        // Handle moved to a new owner: the old owner loses access
        fixture.identities.register("alice", BOB);
        ProtocolException previousOwner = assertThrows(ProtocolException.class,
            () -> vault.withdraw(ALICE, "alice", AssetId.NATIVE));
        assertEquals(ProtocolError.UNAUTHORIZED, previousOwner.getError());

        WithdrawalResult result = vault.withdraw(BOB, "alice", AssetId.NATIVE);
        assertEquals(BOB, result.getRecipient());
        assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE).add(result.getGross()));
    }

    @Test
    @DisplayName("Withdrawal fee rounds down")
    void testWithdrawalFeeRoundsDown() {
        vault.deposit(SENDER, "alice", BigInteger.valueOf(9), AssetId.NATIVE);
        fixture.identities.register("alice", ALICE);

        WithdrawalResult result = vault.withdraw(ALICE, "alice", AssetId.NATIVE);

        assertEquals(BigInteger.ZERO, result.getFee());
        assertEquals(BigInteger.valueOf(9), result.getNet());
    }

    @Test
    @DisplayName("Withdraw-all pays native first, skips empty assets, fails only when nothing was paid")
    void testWithdrawAll() {
        printTestHeader("Withdraw all");

        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        vault.deposit(SENDER, "alice", units(10), TOKEN_ASSET);
        fixture.identities.register("alice", ALICE);
        AssetId emptyToken = AssetId.token(of("71"));

        List<WithdrawalResult> results = vault.withdrawAll(ALICE, "alice", List.of(emptyToken, TOKEN_ASSET));
        printOutput("Results", results);

        assertEquals(2, results.size());
        assertEquals(AssetId.NATIVE, results.get(0).getAsset());
        assertEquals(TOKEN_ASSET, results.get(1).getAsset());
        assertEquals(units(9), fixture.gateway.balanceOf(TOKEN_ASSET, ALICE));
        assertEquals(units(1), vault.accumulatedFees(TOKEN_ASSET));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> vault.withdrawAll(ALICE, "alice", List.of(TOKEN_ASSET)));
        assertEquals(ProtocolError.NOTHING_TO_WITHDRAW, e.getError());
        printSuccess("Only funded assets were paid");
    }

    @Test
    @DisplayName("A failed payout leaves the balance intact")
    void testFailedPayoutRollsBack() {
        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        fixture.identities.register("alice", ALICE);
        fixture.gateway.rejectPaymentsTo(ALICE);

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> fixture.atomically(() -> vault.withdraw(ALICE, "alice", AssetId.NATIVE)));

        assertEquals(ProtocolError.TRANSFER_FAILED, e.getError());
        assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE));
        assertEquals(BigInteger.ZERO, vault.accumulatedFees(AssetId.NATIVE));
    }

    @Test
    @DisplayName("A recipient calling back into the vault during payout is rejected")
    void testReentrantWithdrawRejected() {
        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        fixture.identities.register("alice", ALICE);
        fixture.gateway.onNextPayment(() -> vault.withdraw(ALICE, "alice", AssetId.NATIVE));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> fixture.atomically(() -> vault.withdraw(ALICE, "alice", AssetId.NATIVE)));

        assertEquals(ProtocolError.REENTRANT_CALL, e.getError());
        assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE));
        assertEquals(BigInteger.ZERO, fixture.gateway.balanceOf(AssetId.NATIVE, ALICE));
    }

    @Test
    @DisplayName("Only the fee receiver may claim vault fees, and only when some have accrued")
    void testClaimFees() {
        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        vault.deposit(SENDER, "alice", units(10), TOKEN_ASSET);
        fixture.identities.register("alice", ALICE);
        vault.withdrawAll(ALICE, "alice", List.of(TOKEN_ASSET));

        ProtocolException stranger = assertThrows(ProtocolException.class,
            () -> vault.claimFees(MALLORY, AssetId.NATIVE));
        assertEquals(ProtocolError.UNAUTHORIZED, stranger.getError());

        BigInteger nativeFees = vault.claimNativeFees(DISTRIBUTOR_CUSTODY);
        assertEquals(units(0, 10), nativeFees);
        assertEquals(units(0, 10), fixture.gateway.balanceOf(AssetId.NATIVE, DISTRIBUTOR_CUSTODY));

        Map<AssetId, BigInteger> claimed = vault.claimFeesMultiple(DISTRIBUTOR_CUSTODY,
            List.of(AssetId.NATIVE, TOKEN_ASSET));
        assertEquals(Map.of(TOKEN_ASSET, units(1)), claimed);
        verify(fixture.outbox, times(2)).record(any(FeesClaimedEvent.class));

        ProtocolException empty = assertThrows(ProtocolException.class,
            () -> vault.claimFees(DISTRIBUTOR_CUSTODY, AssetId.NATIVE));
        assertEquals(ProtocolError.NOTHING_TO_CLAIM, empty.getError());
    }

    @Test
    @DisplayName("Owner can change the vault fee rate up to 10%")
    void testSetFeeRate() {
        assertEquals(1000, vault.feeRate());

        vault.setFeeRate(OWNER, 250);
        assertEquals(250, vault.feeRate());

        ProtocolException tooHigh = assertThrows(ProtocolException.class, () -> vault.setFeeRate(OWNER, 1001));
        assertEquals(ProtocolError.INVALID_FEE_RATE, tooHigh.getError());

        ProtocolException notOwner = assertThrows(ProtocolException.class, () -> vault.setFeeRate(MALLORY, 0));
        assertEquals(ProtocolError.UNAUTHORIZED, notOwner.getError());

        vault.deposit(SENDER, "alice", units(1), AssetId.NATIVE);
        fixture.identities.register("alice", ALICE);
        // 2.5% of one unit
        BigInteger expectedNet = ONE_UNIT.multiply(BigInteger.valueOf(975)).divide(BigInteger.valueOf(1000));
        assertEquals(expectedNet, vault.withdraw(ALICE, "alice", null).getNet());
    }
}
