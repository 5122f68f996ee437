package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Request body for buying a listed token. The value must equal the asking price.
 */
@Value
@Builder
@Jacksonized
public class PurchaseRequest {

    @NotBlank(message = "Buyer is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("buyer")
    String buyer;

    @NotNull(message = "Value is required")
    @JsonProperty("value")
    BigInteger value;
}
