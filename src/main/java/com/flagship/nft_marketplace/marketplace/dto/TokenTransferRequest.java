package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TokenTransferRequest {

    @NotBlank(message = "Sender is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Recipient is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("to")
    String to;
}
