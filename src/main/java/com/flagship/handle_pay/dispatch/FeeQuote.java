package com.flagship.handle_pay.dispatch;

import lombok.Value;

import java.math.BigInteger;

/**
 * What a direct transfer of {@code amount} would pay and charge at the current rate.
 */
@Value
public class FeeQuote {
    BigInteger amount;
    int feeRateBps;
    BigInteger fee;
    BigInteger netAmount;
}
