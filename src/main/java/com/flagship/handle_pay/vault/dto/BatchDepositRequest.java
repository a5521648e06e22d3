package com.flagship.handle_pay.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.AssetId;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
@Jacksonized
public class BatchDepositRequest {

    @NotNull(message = "Handles are required")
    @JsonProperty("handles")
    List<String> handles;

    @NotNull(message = "Amounts are required")
    @JsonProperty("amounts")
    List<BigInteger> amounts;

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("attached_value")
    BigInteger attachedValue;
}
