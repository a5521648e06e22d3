package com.flagship.handle_pay.dispatch;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * A batch transfer split by the caller into recipients it knows to be
 * unregistered (escrowed by handle) and recipients it knows to be registered
 * (paid directly by address). The split is trusted, not re-resolved.
 *
 * {@code attachedValue} is the native value sent with the call; it must be
 * null or zero for token batches.
 */
@Value
@Builder
public class BatchTransferCommand {
    @Singular("unregisteredHandle")
    List<String> unregisteredHandles;
    @Singular("vaultAmount")
    List<BigInteger> vaultAmounts;
    @Singular("registeredAddress")
    List<Address> registeredAddresses;
    @Singular("directAmount")
    List<BigInteger> directAmounts;
    AssetId asset;
    BigInteger attachedValue;
}
