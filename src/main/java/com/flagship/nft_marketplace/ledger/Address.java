package com.flagship.nft_marketplace.ledger;

import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a participant in the marketplace: a 20-byte address written as
 * {@code 0x} followed by 40 hex digits.
 *
 * Addresses are normalized to lower case so that equality does not depend on
 * the checksum casing used by the caller.
 */
@Value
public class Address {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /**
     * Sentinel identity. An item whose seller is ZERO is not listed for sale.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    String value;

    private Address(String value) {
        this.value = value;
    }

    /**
     * Parses an address.
     *
     * @throws IllegalArgumentException if the text is not a 0x-prefixed 40 hex digit string
     */
    public static Address of(String value) {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Malformed address: " + value);
        }
        return new Address(value.toLowerCase(Locale.ROOT));
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @Override
    public String toString() {
        return value;
    }
}
