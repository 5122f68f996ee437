package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.receipt.TransactionReceipt;
import lombok.Value;

/**
 * Receipt of a write operation, and whether it was served from an earlier
 * request carrying the same idempotency key.
 */
@Value
public class OperationResult {
    TransactionReceipt receipt;
    boolean replayed;
}
