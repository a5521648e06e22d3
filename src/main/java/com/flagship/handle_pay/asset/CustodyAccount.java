package com.flagship.handle_pay.asset;

import com.flagship.handle_pay.error.ProtocolException;

import java.math.BigInteger;

/**
 * A component's view of its own custody address. Hides the native/token split
 * of {@link AssetTransferGateway} behind receive/pay.
 */
public class CustodyAccount {

    private final Address address;
    private final AssetTransferGateway gateway;

    public CustodyAccount(Address address, AssetTransferGateway gateway) {
        this.address = address.requireNonZero("Custody address");
        this.gateway = gateway;
    }

    public Address getAddress() {
        return address;
    }

    /**
     * Moves {@code amount} of {@code asset} from {@code from} into this custody.
     * For the native coin this is the value attached to the call.
     */
    public void receive(AssetId asset, Address from, BigInteger amount) {
        if (asset.isNative()) {
            gateway.collectValue(from, address, amount);
        } else {
            gateway.pullFrom(asset, from, address, amount);
        }
    }

    /**
     * Pays {@code amount} of {@code asset} out of this custody.
     *
     * @throws ProtocolException TRANSFER_FAILED if the move fails
     */
    public void pay(AssetId asset, Address to, BigInteger amount) {
        if (asset.isNative()) {
            if (!gateway.sendValue(address, to, amount)) {
                throw ProtocolException.transferFailed("Native transfer of " + amount + " to " + to + " failed");
            }
        } else {
            gateway.pushTo(asset, address, to, amount);
        }
    }

    public BigInteger held(AssetId asset) {
        return gateway.balanceOf(asset, address);
    }

    /**
     * Holdings locked against concurrent moves until the current transaction ends.
     */
    public BigInteger heldForUpdate(AssetId asset) {
        return gateway.lockedBalanceOf(asset, address);
    }
}
