package com.flagship.nft_marketplace.receipt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for transaction receipts.
 */
@Repository
public interface TransactionReceiptRepository extends JpaRepository<TransactionReceiptEntity, Long> {

    /**
     * Finds a receipt by idempotency key.
     * Used for idempotency checking.
     */
    Optional<TransactionReceiptEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * All receipts in the order they were committed. Used for replay at startup.
     */
    List<TransactionReceiptEntity> findAllByOrderBySequenceNumberAsc();

    List<TransactionReceiptEntity> findByTokenIdOrderBySequenceNumberAsc(Long tokenId);
}
