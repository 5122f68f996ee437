package com.flagship.nft_marketplace.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request object for posting a transaction.
 * Contains debits and credits that must balance.
 *
 * Invariant: Sum of debits must equal sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    /**
     * Shorthand for a single movement of funds between two addresses.
     */
    public static TransactionRequest transfer(String description, Address from, Address to, BigInteger amount) {
        return new TransactionRequest(
            description,
            List.of(DebitCredit.of(from, amount, "Sent to " + to)),
            List.of(DebitCredit.of(to, amount, "Received from " + from))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public boolean isEmpty() {
        return debits.isEmpty() && credits.isEmpty();
    }

    public BigInteger getDebitTotal() {
        return debits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger getCreditTotal() {
        return credits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Represents a single debit or credit entry.
     */
    @Value
    public static class DebitCredit {
        Address account;
        BigInteger amount;
        String description;

        private DebitCredit(Address account, BigInteger amount, String description) {
            this.account = Objects.requireNonNull(account);
            this.amount = Objects.requireNonNull(amount);
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.description = description;
        }

        public static DebitCredit of(Address account, BigInteger amount, String description) {
            return new DebitCredit(account, amount, description);
        }
    }

    /**
     * Collects legs of a multi-party payment. Zero amounts are skipped so that
     * a zero royalty fee does not produce an invalid entry.
     */
    public static class Builder {
        private final String description;
        private final List<DebitCredit> debits = new ArrayList<>();
        private final List<DebitCredit> credits = new ArrayList<>();

        public Builder(String description) {
            this.description = description;
        }

        public Builder move(Address from, Address to, BigInteger amount) {
            if (amount.signum() > 0) {
                debits.add(DebitCredit.of(from, amount, "Sent to " + to));
                credits.add(DebitCredit.of(to, amount, "Received from " + from));
            }
            return this;
        }

        public TransactionRequest build() {
            return new TransactionRequest(description, List.copyOf(debits), List.copyOf(credits));
        }
    }
}
