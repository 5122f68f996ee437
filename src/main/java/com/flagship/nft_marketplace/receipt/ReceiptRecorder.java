package com.flagship.nft_marketplace.receipt;

import com.flagship.nft_marketplace.marketplace.LedgerTransaction;
import com.flagship.nft_marketplace.marketplace.TransactionObserver;
import com.flagship.nft_marketplace.marketplace.event.MarketEvent;
import com.flagship.nft_marketplace.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Persists every ledger transaction as a receipt and writes its events to the outbox.
 *
 * Runs inside the ledger's atomic scope and commits its own database
 * transaction there, before the ledger releases its lock. A failed insert or a
 * failed commit rolls the ledger operation back, so the receipts table never
 * skips a sequence number that a later operation reuses.
 *
 * The idempotency key of the current request travels through a thread-local,
 * because the ledger calls observers synchronously on the calling thread.
 */
@Component
@Slf4j
public class ReceiptRecorder implements TransactionObserver {

    public static final String AGGREGATE_TYPE = "MarketItem";

    private static final ThreadLocal<String> pendingIdempotencyKey = new ThreadLocal<>();

    private final ReceiptPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final TransactionTemplate transactionTemplate;

    public ReceiptRecorder(ReceiptPersistenceService persistenceService,
                           OutboxService outboxService,
                           PlatformTransactionManager transactionManager) {
        this.persistenceService = persistenceService;
        this.outboxService = outboxService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Runs a ledger operation so that its receipt carries the given idempotency key.
     */
    public <T> T withIdempotencyKey(String idempotencyKey, Supplier<T> operation) {
        pendingIdempotencyKey.set(idempotencyKey);
        try {
            return operation.get();
        } finally {
            pendingIdempotencyKey.remove();
        }
    }

    @Override
    public void onTransaction(LedgerTransaction transaction) {
        String idempotencyKey = pendingIdempotencyKey.get();
        transactionTemplate.executeWithoutResult(status -> {
            persistenceService.save(TransactionReceipt.of(transaction, idempotencyKey));
            for (MarketEvent event : transaction.getEvents()) {
                outboxService.saveEvent(AGGREGATE_TYPE, Long.toString(event.getTokenId()),
                    event.getEventType(), event);
            }
        });

        log.debug("Committed receipt #{} with {} event(s)",
            transaction.getSequenceNumber(), transaction.getEvents().size());
    }
}
