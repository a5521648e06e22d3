package com.flagship.handle_pay.dispatch;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a single transfer. For an escrowed transfer {@code recipient} is
 * null, {@code netAmount == amount} and {@code fee} is zero.
 */
@Value
public class TransferResult {
    TransferRoute route;
    Address sender;
    String handle;
    String identityHash;
    Address recipient;
    AssetId asset;
    BigInteger amount;
    BigInteger netAmount;
    BigInteger fee;
}
