package com.flagship.nft_marketplace.receipt;

import com.flagship.nft_marketplace.marketplace.LedgerTransaction;
import com.flagship.nft_marketplace.marketplace.TransactionType;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Persisted record of a committed ledger transaction.
 *
 * Receipts are the durable journal of the marketplace: replaying them in
 * sequence order against a freshly deployed ledger rebuilds its state.
 */
@Value
public class TransactionReceipt {
    long sequenceNumber;
    TransactionType type;
    String caller;
    Long tokenId;
    BigInteger value;
    BigInteger amount;
    String counterparty;
    String idempotencyKey;
    Instant createdAt;

    /**
     * Creates a receipt for a transaction that is about to commit.
     *
     * @param idempotencyKey key supplied by the client, or null
     */
    public static TransactionReceipt of(LedgerTransaction transaction, String idempotencyKey) {
        return new TransactionReceipt(
            transaction.getSequenceNumber(),
            transaction.getType(),
            transaction.getCaller() != null ? transaction.getCaller().toString() : null,
            transaction.getTokenId(),
            transaction.getValue(),
            transaction.getAmount(),
            transaction.getCounterparty() != null ? transaction.getCounterparty().toString() : null,
            idempotencyKey,
            null // set by @PrePersist
        );
    }
}
