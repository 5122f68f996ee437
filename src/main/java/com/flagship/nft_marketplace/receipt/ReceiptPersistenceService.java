package com.flagship.nft_marketplace.receipt;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for receipt persistence operations.
 *
 * This service bridges the domain layer (TransactionReceipt) and persistence layer
 * (TransactionReceiptEntity).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptPersistenceService {

    private final TransactionReceiptRepository receiptRepository;

    /**
     * Saves a receipt and flushes it, so constraint violations surface while
     * the ledger operation that produced it can still roll back.
     *
     * Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionReceipt save(TransactionReceipt receipt) {
        TransactionReceiptEntity saved = receiptRepository.saveAndFlush(TransactionReceiptEntity.fromDomain(receipt));
        log.debug("Saved receipt #{} ({})", saved.getSequenceNumber(), saved.getType());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<TransactionReceipt> findBySequenceNumber(long sequenceNumber) {
        return receiptRepository.findById(sequenceNumber)
            .map(TransactionReceiptEntity::toDomain);
    }

    /**
     * All receipts in commit order.
     */
    @Transactional(readOnly = true)
    public List<TransactionReceipt> findAllInOrder() {
        return receiptRepository.findAllByOrderBySequenceNumberAsc()
            .stream()
            .map(TransactionReceiptEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<TransactionReceipt> findByTokenId(long tokenId) {
        return receiptRepository.findByTokenIdOrderBySequenceNumberAsc(tokenId)
            .stream()
            .map(TransactionReceiptEntity::toDomain)
            .toList();
    }
}
