package com.flagship.handle_pay.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.BatchTransferCommand;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.List;

/**
 * Pre-split batch transfer. Missing lists are read as empty.
 */
@Value
@Builder
@Jacksonized
public class BatchTransferRequest {

    @JsonProperty("unregistered_handles")
    List<String> unregisteredHandles;

    @JsonProperty("vault_amounts")
    List<BigInteger> vaultAmounts;

    @JsonProperty("registered_addresses")
    List<Address> registeredAddresses;

    @JsonProperty("direct_amounts")
    List<BigInteger> directAmounts;

    @JsonProperty("asset")
    AssetId asset;

    /**
     * Native value sent with the call; required for native batches.
     */
    @JsonProperty("attached_value")
    BigInteger attachedValue;

    public BatchTransferCommand toCommand() {
        return BatchTransferCommand.builder()
            .unregisteredHandles(orEmpty(unregisteredHandles))
            .vaultAmounts(orEmpty(vaultAmounts))
            .registeredAddresses(orEmpty(registeredAddresses))
            .directAmounts(orEmpty(directAmounts))
            .asset(asset)
            .attachedValue(attachedValue)
            .build();
    }

    public int recipientCount() {
        return orEmpty(unregisteredHandles).size() + orEmpty(registeredAddresses).size();
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
