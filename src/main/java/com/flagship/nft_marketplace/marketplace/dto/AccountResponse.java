package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("token_count")
    long tokenCount;

    @JsonProperty("funds")
    BigInteger funds;
}
