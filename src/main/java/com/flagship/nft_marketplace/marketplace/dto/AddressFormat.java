package com.flagship.nft_marketplace.marketplace.dto;

/**
 * Validation constants for account addresses in request bodies.
 */
final class AddressFormat {

    static final String REGEX = "^0x[0-9a-fA-F]{40}$";
    static final String MESSAGE = "Must be a 0x-prefixed 20-byte hex address";

    private AddressFormat() {
    }
}
