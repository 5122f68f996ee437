package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TokenResponse {

    @JsonProperty("token_id")
    long tokenId;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("token_uri")
    String tokenUri;
}
