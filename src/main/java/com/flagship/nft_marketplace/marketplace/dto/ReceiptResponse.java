package com.flagship.nft_marketplace.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.nft_marketplace.marketplace.TransactionType;
import com.flagship.nft_marketplace.receipt.TransactionReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response DTO for a committed ledger transaction.
 */
@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("caller")
    String caller;

    @JsonProperty("token_id")
    Long tokenId;

    @JsonProperty("value")
    BigInteger value;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("counterparty")
    String counterparty;

    @JsonProperty("created_at")
    Instant createdAt;

    /** True when an earlier request with the same idempotency key produced this receipt. */
    @JsonProperty("replayed")
    boolean replayed;

    public static ReceiptResponse from(TransactionReceipt receipt, boolean replayed) {
        return ReceiptResponse.builder()
            .sequenceNumber(receipt.getSequenceNumber())
            .type(receipt.getType())
            .caller(receipt.getCaller())
            .tokenId(receipt.getTokenId())
            .value(receipt.getValue())
            .amount(receipt.getAmount())
            .counterparty(receipt.getCounterparty())
            .createdAt(receipt.getCreatedAt())
            .replayed(replayed)
            .build();
    }
}
