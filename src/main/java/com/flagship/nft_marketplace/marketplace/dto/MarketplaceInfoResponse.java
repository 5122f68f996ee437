package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Collection metadata and the ledger's current state.
 */
@Value
@Builder
public class MarketplaceInfoResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("address")
    String address;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("artist")
    String artist;

    @JsonProperty("royalty_fee")
    BigInteger royaltyFee;

    @JsonProperty("total_supply")
    long totalSupply;

    @JsonProperty("unsold_count")
    int unsoldCount;

    @JsonProperty("base_uri")
    String baseUri;

    @JsonProperty("contract_balance")
    BigInteger contractBalance;

    @JsonProperty("sequence_number")
    long sequenceNumber;
}
