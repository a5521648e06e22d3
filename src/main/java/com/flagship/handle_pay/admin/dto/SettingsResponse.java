package com.flagship.handle_pay.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.settings.ComponentSettings;
import com.flagship.handle_pay.settings.ProtocolComponent;
import lombok.Value;

@Value
public class SettingsResponse {

    @JsonProperty("component")
    ProtocolComponent component;

    @JsonProperty("owner")
    Address owner;

    @JsonProperty("fee_rate_bps")
    int feeRateBps;

    @JsonProperty("max_fee_rate_bps")
    int maxFeeRateBps;

    @JsonProperty("fee_receiver")
    Address feeReceiver;

    public static SettingsResponse from(ComponentSettings settings) {
        return new SettingsResponse(settings.getComponent(), settings.getOwner(), settings.getFeeRateBps(),
            settings.getComponent().getMaxFeeRateBps(), settings.getFeeReceiver());
    }
}
