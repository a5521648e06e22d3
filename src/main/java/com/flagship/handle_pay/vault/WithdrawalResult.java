package com.flagship.handle_pay.vault;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of draining one vault balance. {@code gross = net + fee}.
 */
@Value
public class WithdrawalResult {
    String handle;
    String identityHash;
    Address recipient;
    AssetId asset;
    BigInteger gross;
    BigInteger net;
    BigInteger fee;
}
