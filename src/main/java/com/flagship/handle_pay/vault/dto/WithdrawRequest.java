package com.flagship.handle_pay.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.AssetId;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Withdrawal of one asset ({@code asset}) or, for withdraw-all, of the native
 * coin plus every listed {@code assets} entry.
 */
@Value
@Builder
@Jacksonized
public class WithdrawRequest {

    @NotEmpty(message = "Handle is required")
    @JsonProperty("handle")
    String handle;

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("assets")
    List<AssetId> assets;
}
