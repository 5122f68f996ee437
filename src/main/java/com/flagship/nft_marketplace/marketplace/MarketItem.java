package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;
import lombok.Value;

import java.math.BigInteger;

/**
 * Sale listing bound to one token.
 *
 * Items are immutable; listing changes produce a new instance. A seller of
 * {@link Address#ZERO} means the token is held privately and cannot be bought.
 */
@Value
public class MarketItem {
    long tokenId;
    Address seller;
    BigInteger price;

    public boolean isListed() {
        return !seller.isZero();
    }

    /**
     * Marks the item as sold. The last price is kept for reference.
     */
    public MarketItem unlist() {
        if (!isListed()) {
            throw new IllegalStateException("Token " + tokenId + " is not listed");
        }
        return new MarketItem(tokenId, Address.ZERO, price);
    }

    /**
     * Lists the item again for the given seller and price.
     */
    public MarketItem relist(Address newSeller, BigInteger newPrice) {
        if (newSeller.isZero()) {
            throw new IllegalArgumentException("Seller cannot be the zero address");
        }
        if (newPrice.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive");
        }
        return new MarketItem(tokenId, newSeller, newPrice);
    }
}
