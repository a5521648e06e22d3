package com.flagship.handle_pay.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identifies a transferable asset. The native coin is the reserved zero address;
 * every other value is the address of a fungible token.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssetId {

    public static final AssetId NATIVE = new AssetId(Address.ZERO);

    Address address;

    public static AssetId token(Address tokenAddress) {
        return tokenAddress.isZero() ? NATIVE : new AssetId(tokenAddress);
    }

    @JsonCreator
    public static AssetId of(String value) {
        return token(Address.of(value));
    }

    /**
     * Null means "no asset given", which selects the native coin.
     */
    public static AssetId orNative(AssetId asset) {
        return asset == null ? NATIVE : asset;
    }

    public boolean isNative() {
        return address.isZero();
    }

    /**
     * Short tag for metrics and logs.
     */
    public String kind() {
        return isNative() ? "native" : "token";
    }

    @JsonValue
    @Override
    public String toString() {
        return address.getValue();
    }
}
