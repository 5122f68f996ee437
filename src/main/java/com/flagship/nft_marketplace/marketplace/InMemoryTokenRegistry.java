package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Token registry held in memory. Not thread-safe; the marketplace ledger serializes access.
 */
public class InMemoryTokenRegistry implements TokenRegistry {

    private final Map<Long, Address> owners = new TreeMap<>();
    private final Map<Address, Long> balances = new HashMap<>();

    @Override
    public void mint(long tokenId, Address to) {
        if (to.isZero()) {
            throw new IllegalArgumentException("Cannot mint to the zero address");
        }
        if (owners.containsKey(tokenId)) {
            throw new IllegalStateException("Token already minted: " + tokenId);
        }
        owners.put(tokenId, to);
        balances.merge(to, 1L, Long::sum);
    }

    @Override
    public void transfer(long tokenId, Address from, Address to) {
        Address current = ownerOf(tokenId);
        if (!current.equals(from)) {
            throw new TokenTransferException(
                String.format("Transfer of token %d from incorrect owner: expected=%s, actual=%s",
                    tokenId, from, current));
        }
        if (to.isZero()) {
            throw new TokenTransferException("Transfer of token " + tokenId + " to the zero address");
        }
        owners.put(tokenId, to);
        balances.merge(from, -1L, Long::sum);
        balances.merge(to, 1L, Long::sum);
    }

    @Override
    public Address ownerOf(long tokenId) {
        Address owner = owners.get(tokenId);
        if (owner == null) {
            throw new TokenTransferException("Token does not exist: " + tokenId);
        }
        return owner;
    }

    @Override
    public long balanceOf(Address owner) {
        return balances.getOrDefault(owner, 0L);
    }

    @Override
    public long totalSupply() {
        return owners.size();
    }
}
