package com.flagship.handle_pay.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FeeRateRequest {

    @NotNull(message = "Fee rate is required")
    @JsonProperty("fee_rate_bps")
    Integer feeRateBps;
}
