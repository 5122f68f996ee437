package com.flagship.nft_marketplace.ledger;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Thrown when posting a transaction would leave an account with a negative balance.
 */
@Getter
public class InsufficientFundsException extends IllegalStateException {

    private final Address account;
    private final BigInteger balance;
    private final BigInteger required;

    public InsufficientFundsException(Address account, BigInteger balance, BigInteger required) {
        super(String.format("Insufficient funds in %s: balance=%s, required=%s", account, balance, required));
        this.account = account;
        this.balance = balance;
        this.required = required;
    }
}
