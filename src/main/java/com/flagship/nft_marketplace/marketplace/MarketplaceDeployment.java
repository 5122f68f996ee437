package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Construction arguments of a marketplace ledger.
 */
@Value
@Builder
public class MarketplaceDeployment {
    /** The ledger's own identity; escrow owner of every listed token. */
    Address address;
    Address deployer;
    Address artist;
    BigInteger royaltyFee;
    List<BigInteger> prices;
    /** Paid by the deployer into the ledger balance; must cover one royalty fee per token. */
    BigInteger deposit;
    String name;
    String symbol;
    String baseUri;
}
