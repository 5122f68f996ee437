package com.flagship.nft_marketplace.marketplace.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when an owner returns a token to escrow with a new asking price.
 */
@Value
public class MarketItemRelistedEvent implements MarketEvent {
    UUID eventId;
    long tokenId;
    long sequenceNumber;
    String seller;
    BigInteger price;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MarketItemRelisted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MarketItemRelistedEvent of(long sequenceNumber, long tokenId, String seller, BigInteger price) {
        return new MarketItemRelistedEvent(
            UUID.randomUUID(),
            tokenId,
            sequenceNumber,
            seller,
            price,
            Instant.now()
        );
    }
}
