package com.flagship.handle_pay.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * 20-byte account identifier, held as {@code 0x} + 40 lowercase hex digits.
 *
 * Lowercase is the canonical form for storage and comparison; use
 * {@link #toChecksum()} for display.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Address {

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    String value;

    @JsonCreator
    public static Address of(String value) {
        if (value == null || !WalletUtils.isValidAddress(value)) {
            throw new ProtocolException(ProtocolError.INVALID_ADDRESS, "Invalid address: " + value);
        }
        String hex = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        return new Address("0x" + hex.toLowerCase(Locale.ROOT));
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Rejects the zero address.
     */
    public Address requireNonZero(String role) {
        if (isZero()) {
            throw new ProtocolException(ProtocolError.INVALID_ADDRESS, role + " must not be the zero address");
        }
        return this;
    }

    public String toChecksum() {
        return Keys.toChecksumAddress(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
