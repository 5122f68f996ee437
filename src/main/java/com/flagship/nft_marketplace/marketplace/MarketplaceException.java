package com.flagship.nft_marketplace.marketplace;

import lombok.Getter;

/**
 * A marketplace operation was rejected. The ledger is left exactly as it was
 * before the operation started.
 */
@Getter
public class MarketplaceException extends RuntimeException {

    private final ErrorKind kind;

    public MarketplaceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MarketplaceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
