package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.marketplace.event.MarketEvent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Record of one committed ledger operation.
 *
 * Holds every input needed to apply the operation again, so a ledger built
 * from the same deployment reaches the same state by replaying these records
 * in sequence order.
 */
@Value
@Builder
public class LedgerTransaction {
    long sequenceNumber;
    TransactionType type;
    Address caller;
    /** Null for operations that do not target a token. */
    Long tokenId;
    /** Payment attached by the caller. */
    BigInteger value;
    /** New price, new royalty fee or funded amount, depending on the type. */
    BigInteger amount;
    /** Recipient of a token transfer, new owner, or funded account. */
    Address counterparty;
    @Singular
    List<MarketEvent> events;
}
