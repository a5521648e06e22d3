package com.flagship.handle_pay.asset;

import java.math.BigInteger;

/**
 * Capability for moving units of an asset between holders.
 *
 * The native methods mirror a value call: {@link #sendValue} reports failure
 * through its return value. The token methods are the "safe" variants and throw
 * {@link com.flagship.handle_pay.error.ProtocolException} with
 * {@code TRANSFER_FAILED} instead of returning false.
 *
 * Implementations run inside the caller's transaction, so a failure raised later
 * in the same call rolls back every move made so far.
 */
public interface AssetTransferGateway {

    /**
     * Moves value attached to a call from the caller into a component's custody.
     *
     * @throws com.flagship.handle_pay.error.ProtocolException TRANSFER_FAILED if the caller cannot cover it
     */
    void collectValue(Address from, Address custody, BigInteger amount);

    /**
     * Sends native coin out of custody.
     *
     * @return false if the move failed; nothing is moved in that case
     */
    boolean sendValue(Address custody, Address to, BigInteger amount);

    /**
     * Pulls token units from a holder into custody.
     */
    void pullFrom(AssetId token, Address from, Address custody, BigInteger amount);

    /**
     * Pushes token units out of custody.
     */
    void pushTo(AssetId token, Address custody, Address to, BigInteger amount);

    /**
     * Current holdings of an asset (native or token).
     */
    BigInteger balanceOf(AssetId asset, Address holder);

    /**
     * Holdings read under a row lock held until the caller's transaction ends.
     * Use when a payout is computed from the balance itself.
     */
    BigInteger lockedBalanceOf(AssetId asset, Address holder);
}
