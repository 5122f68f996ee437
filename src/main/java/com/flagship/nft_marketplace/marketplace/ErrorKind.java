package com.flagship.nft_marketplace.marketplace;

/**
 * Category of a rejected marketplace operation.
 */
public enum ErrorKind {
    /** Caller lacks the privilege the operation requires. */
    AUTHORIZATION,
    /** Attached value differs from the exact amount required. */
    PAYMENT_MISMATCH,
    /** Payer does not hold enough funds. */
    INSUFFICIENT_FUNDS,
    /** Non-positive price, token id out of range, unusable address. */
    INVALID_ARGUMENT,
    /** Current ownership or listing state contradicts the operation. */
    STATE_INTEGRITY
}
