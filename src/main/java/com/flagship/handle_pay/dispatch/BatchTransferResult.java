package com.flagship.handle_pay.dispatch;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch transfer.
 *
 * {@code fee} is what accrued to the dispatcher pool, rounding dust included, so
 * {@code directPaid + fee + escrowedTotal} equals the batch total exactly.
 */
@Value
public class BatchTransferResult {
    UUID batchId;
    Address sender;
    AssetId asset;
    BigInteger escrowedTotal;
    BigInteger directTotal;
    BigInteger directPaid;
    BigInteger fee;
    List<BigInteger> directNets;

    public BigInteger total() {
        return escrowedTotal.add(directTotal);
    }
}
