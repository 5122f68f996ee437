package com.flagship.nft_marketplace.marketplace.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a listed token is bought at its asking price.
 *
 * Carries the seller that received the price, not the artist that received
 * the royalty fee.
 */
@Value
public class MarketItemBoughtEvent implements MarketEvent {
    UUID eventId;
    long tokenId;
    long sequenceNumber;
    String seller;
    String buyer;
    BigInteger price;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MarketItemBought";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MarketItemBoughtEvent of(long sequenceNumber, long tokenId, String seller,
                                           String buyer, BigInteger price) {
        return new MarketItemBoughtEvent(
            UUID.randomUUID(),
            tokenId,
            sequenceNumber,
            seller,
            buyer,
            price,
            Instant.now()
        );
    }
}
