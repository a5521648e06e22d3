package com.flagship.handle_pay.asset;

import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;

import java.math.BigInteger;
import java.util.List;

/**
 * Unsigned 256-bit amount arithmetic.
 */
public final class Amounts {

    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts() {
    }

    public static boolean isPositive(BigInteger amount) {
        return amount != null && amount.signum() > 0;
    }

    /**
     * Validates a single amount: present, strictly positive and within uint256.
     */
    public static BigInteger requirePositive(BigInteger amount, String what) {
        if (!isPositive(amount)) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, what + " must be greater than zero");
        }
        if (amount.compareTo(UINT256_MAX) > 0) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, what + " exceeds uint256 range");
        }
        return amount;
    }

    /**
     * Overflow-checked sum of a list of positive amounts.
     *
     * @throws ProtocolException INVALID_AMOUNT if any element is not positive or the total overflows uint256
     */
    public static BigInteger sum(List<BigInteger> amounts) {
        return amounts.stream()
            .map(amount -> requirePositive(amount, "Batch amount"))
            .reduce(BigInteger.ZERO, Amounts::addExact);
    }

    public static BigInteger addExact(BigInteger a, BigInteger b) {
        BigInteger result = a.add(b);
        if (result.compareTo(UINT256_MAX) > 0) {
            throw new ProtocolException(ProtocolError.INVALID_AMOUNT, "Amount sum overflows uint256");
        }
        return result;
    }

    /**
     * Native batches must attach exactly their total; token batches attach nothing.
     *
     * @param attachedValue null is read as zero
     * @throws ProtocolException AMOUNT_MISMATCH otherwise
     */
    public static void requireAttachedValue(AssetId asset, BigInteger total, BigInteger attachedValue) {
        BigInteger attached = attachedValue == null ? BigInteger.ZERO : attachedValue;
        if (asset.isNative()) {
            if (!attached.equals(total)) {
                throw new ProtocolException(ProtocolError.AMOUNT_MISMATCH,
                    String.format("Attached value %s does not equal batch total %s", attached, total));
            }
        } else if (attached.signum() != 0) {
            throw new ProtocolException(ProtocolError.AMOUNT_MISMATCH,
                "Native value must not be attached to a token batch");
        }
    }
}
