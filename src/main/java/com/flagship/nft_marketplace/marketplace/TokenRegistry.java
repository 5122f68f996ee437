package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;

/**
 * Owner map of the token collection. Every minted token has exactly one owner.
 */
public interface TokenRegistry {

    /**
     * Creates a token owned by {@code to}.
     *
     * @throws IllegalStateException if the token already exists
     */
    void mint(long tokenId, Address to);

    /**
     * Moves a token between owners.
     *
     * @throws TokenTransferException if the token does not exist or is not owned by {@code from}
     */
    void transfer(long tokenId, Address from, Address to);

    /**
     * @throws TokenTransferException if the token does not exist
     */
    Address ownerOf(long tokenId);

    /**
     * Number of tokens held by the owner.
     */
    long balanceOf(Address owner);

    long totalSupply();
}
