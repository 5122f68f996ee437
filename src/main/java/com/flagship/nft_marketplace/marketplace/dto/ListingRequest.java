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
 * Request body for relisting an owned token.
 *
 * The price is checked by the ledger rather than here, so a non-positive
 * price gets the ledger's own error message.
 */
@Value
@Builder
@Jacksonized
public class ListingRequest {

    @NotBlank(message = "Seller is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("seller")
    String seller;

    @NotNull(message = "Price is required")
    @JsonProperty("price")
    BigInteger price;

    /** Must equal the current royalty fee. */
    @NotNull(message = "Value is required")
    @JsonProperty("value")
    BigInteger value;
}
