package com.flagship.handle_pay.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.vault.WithdrawalResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("handle")
    String handle;

    @JsonProperty("recipient")
    Address recipient;

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("gross")
    BigInteger gross;

    @JsonProperty("net")
    BigInteger net;

    @JsonProperty("fee")
    BigInteger fee;

    public static WithdrawalResponse from(WithdrawalResult result) {
        return WithdrawalResponse.builder()
            .handle(result.getHandle())
            .recipient(result.getRecipient())
            .asset(result.getAsset())
            .gross(result.getGross())
            .net(result.getNet())
            .fee(result.getFee())
            .build();
    }
}
