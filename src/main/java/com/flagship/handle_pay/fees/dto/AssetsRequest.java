package com.flagship.handle_pay.fees.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.AssetId;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Names one asset ({@code asset}) or several ({@code assets}). With neither,
 * the native coin is meant. A non-empty {@code assets} selects the best-effort
 * multi-asset variant of the operation.
 */
@Value
@Builder
@Jacksonized
public class AssetsRequest {

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("assets")
    List<AssetId> assets;

    public boolean isMultiple() {
        return assets != null && !assets.isEmpty();
    }
}
