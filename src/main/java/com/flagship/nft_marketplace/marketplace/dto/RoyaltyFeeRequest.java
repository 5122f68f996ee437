package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

@Value
@Builder
@Jacksonized
public class RoyaltyFeeRequest {

    @NotBlank(message = "Caller is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("caller")
    String caller;

    @NotNull(message = "Fee is required")
    @JsonProperty("fee")
    BigInteger fee;
}
