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
public class OwnershipTransferRequest {

    @NotBlank(message = "Caller is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("caller")
    String caller;

    @NotBlank(message = "New owner is required")
    @Pattern(regexp = AddressFormat.REGEX, message = AddressFormat.MESSAGE)
    @JsonProperty("new_owner")
    String newOwner;
}
