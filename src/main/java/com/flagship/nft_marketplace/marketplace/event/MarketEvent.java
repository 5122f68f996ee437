package com.flagship.nft_marketplace.marketplace.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for market events.
 *
 * Events are facts about committed ledger transactions. They are only ever
 * published for operations that fully applied.
 */
public interface MarketEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The token this event is about.
     */
    long getTokenId();

    /**
     * Sequence number of the ledger transaction that emitted the event.
     */
    long getSequenceNumber();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
