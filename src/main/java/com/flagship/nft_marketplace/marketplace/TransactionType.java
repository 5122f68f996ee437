package com.flagship.nft_marketplace.marketplace;

/**
 * Kinds of state-changing ledger operations.
 */
public enum TransactionType {
    PURCHASE,
    RELIST,
    TOKEN_TRANSFER,
    ROYALTY_FEE_UPDATE,
    OWNERSHIP_TRANSFER,
    FUNDING
}
