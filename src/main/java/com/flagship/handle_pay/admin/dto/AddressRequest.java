package com.flagship.handle_pay.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.Address;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * New fee receiver or owner.
 */
@Value
@Builder
@Jacksonized
public class AddressRequest {

    @NotNull(message = "Address is required")
    @JsonProperty("address")
    Address address;
}
