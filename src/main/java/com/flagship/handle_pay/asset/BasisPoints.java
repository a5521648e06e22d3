package com.flagship.handle_pay.asset;

import java.math.BigInteger;

/**
 * Basis-point arithmetic (1 bp = 1/10000). All results round down.
 */
public final class BasisPoints {

    public static final int DENOMINATOR = 10_000;

    private static final BigInteger BIG_DENOMINATOR = BigInteger.valueOf(DENOMINATOR);

    private BasisPoints() {
    }

    /**
     * floor(amount * rate / 10000)
     */
    public static BigInteger portion(BigInteger amount, int rateBps) {
        requireRate(rateBps);
        return amount.multiply(BigInteger.valueOf(rateBps)).divide(BIG_DENOMINATOR);
    }

    /**
     * amount - portion(amount, rate). Never negative.
     */
    public static BigInteger remainder(BigInteger amount, int rateBps) {
        return amount.subtract(portion(amount, rateBps));
    }

    /**
     * floor(amount * (10000 - rate) / 10000), the per-recipient net used by batches.
     * Can be one unit below {@link #remainder} for the same inputs.
     */
    public static BigInteger complementPortion(BigInteger amount, int rateBps) {
        requireRate(rateBps);
        return portion(amount, DENOMINATOR - rateBps);
    }

    public static boolean isValidRate(int rateBps) {
        return rateBps >= 0 && rateBps <= DENOMINATOR;
    }

    private static void requireRate(int rateBps) {
        if (!isValidRate(rateBps)) {
            throw new IllegalArgumentException("Rate out of basis-point range: " + rateBps);
        }
    }
}
