package com.flagship.nft_marketplace.marketplace;

/**
 * Notified of every ledger operation just before it commits.
 *
 * Observers run while the ledger lock is held. An exception from an observer
 * rolls the operation back, which makes observers the place to persist
 * anything that must never disagree with the ledger.
 */
@FunctionalInterface
public interface TransactionObserver {

    void onTransaction(LedgerTransaction transaction);
}
