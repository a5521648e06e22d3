package com.flagship.handle_pay.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("handle")
    String handle;

    @JsonProperty("identity_hash")
    String identityHash;

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("balance")
    BigInteger balance;
}
