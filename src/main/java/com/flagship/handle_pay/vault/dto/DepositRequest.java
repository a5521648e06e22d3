package com.flagship.handle_pay.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.AssetId;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

@Value
@Builder
@Jacksonized
public class DepositRequest {

    @NotEmpty(message = "Handle is required")
    @JsonProperty("handle")
    String handle;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("asset")
    AssetId asset;
}
