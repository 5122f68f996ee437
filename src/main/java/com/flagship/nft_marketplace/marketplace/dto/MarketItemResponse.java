package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.nft_marketplace.marketplace.MarketItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class MarketItemResponse {

    @JsonProperty("token_id")
    long tokenId;

    /** Zero address once the item is sold. */
    @JsonProperty("seller")
    String seller;

    @JsonProperty("price")
    BigInteger price;

    @JsonProperty("listed")
    boolean listed;

    public static MarketItemResponse from(MarketItem item) {
        return MarketItemResponse.builder()
            .tokenId(item.getTokenId())
            .seller(item.getSeller().toString())
            .price(item.getPrice())
            .listed(item.isListed())
            .build();
    }
}
