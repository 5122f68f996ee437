package com.flagship.nft_marketplace.marketplace;

/**
 * The token registry refused a transfer because the stated current owner is wrong
 * or the token does not exist.
 */
public class TokenTransferException extends IllegalStateException {

    public TokenTransferException(String message) {
        super(message);
    }
}
