package com.flagship.nft_marketplace.receipt;

import com.flagship.nft_marketplace.marketplace.TransactionType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * JPA Entity for transaction receipts.
 *
 * Receipts are append-only:
 * - No @Setter: a receipt describes a committed transaction and never changes
 * - Every column is updatable = false
 * - Controlled factory: fromDomain() is the only way to create entities
 *
 * The idempotency key is stored here so that a retried request can be
 * answered with the receipt of the transaction it already produced.
 */
@Entity
@Table(
    name = "transaction_receipts",
    indexes = {
        @Index(name = "idx_receipts_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_receipts_token_id", columnList = "token_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionReceiptEntity {

    @Id
    @Column(name = "sequence_number", nullable = false, updatable = false)
    private Long sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionType type;

    @Column(nullable = false, updatable = false, length = 42)
    private String caller;

    @Column(name = "token_id", updatable = false)
    private Long tokenId;

    @Column(name = "attached_value", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger value;

    @Column(updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(updatable = false, length = 42)
    private String counterparty;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static TransactionReceiptEntity fromDomain(TransactionReceipt receipt) {
        return new TransactionReceiptEntity(
            receipt.getSequenceNumber(),
            receipt.getType(),
            receipt.getCaller(),
            receipt.getTokenId(),
            receipt.getValue(),
            receipt.getAmount(),
            receipt.getCounterparty(),
            receipt.getIdempotencyKey(),
            null // createdAt - set by @PrePersist
        );
    }

    public TransactionReceipt toDomain() {
        return new TransactionReceipt(
            sequenceNumber,
            type,
            caller,
            tokenId,
            value,
            amount,
            counterparty,
            idempotencyKey,
            createdAt
        );
    }
}
