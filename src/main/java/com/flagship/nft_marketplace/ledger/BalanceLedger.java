package com.flagship.nft_marketplace.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory double-entry ledger of currency balances.
 *
 * This class enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions)
 * 2. No account except {@link #ISSUER} may go negative
 * 3. Entries are immutable once written; the only way to remove them is
 *    {@link #revert(UUID)} of the most recent transaction
 *
 * Not thread-safe. The marketplace ledger serializes all access.
 */
@Slf4j
public class BalanceLedger {

    /**
     * Source of newly issued funds. Its balance goes negative by the amount in circulation.
     */
    public static final Address ISSUER = Address.of("0x0000000000000000000000000000000000000001");

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final LinkedHashMap<UUID, List<LedgerEntry>> transactions = new LinkedHashMap<>();
    private long nextSequence = 1;

    /**
     * Posts a transaction to the ledger.
     *
     * @param request The transaction request with debits and credits
     * @return The UUID of the created transaction
     * @throws IllegalArgumentException if the transaction is empty or not balanced
     * @throws InsufficientFundsException if an account would go negative
     */
    public UUID postTransaction(TransactionRequest request) {
        if (request.isEmpty()) {
            throw new IllegalArgumentException("Transaction has no entries: " + request.getDescription());
        }
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        Map<Address, BigInteger> net = netMovements(request);
        for (Map.Entry<Address, BigInteger> movement : net.entrySet()) {
            Address account = movement.getKey();
            BigInteger balance = getBalance(account);
            if (!account.equals(ISSUER) && balance.add(movement.getValue()).signum() < 0) {
                throw new InsufficientFundsException(account, balance, movement.getValue().negate());
            }
        }

        UUID transactionId = UUID.randomUUID();
        List<LedgerEntry> entries = new ArrayList<>();
        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            entries.add(createEntry(transactionId, debit, EntryType.DEBIT));
        }
        for (TransactionRequest.DebitCredit credit : request.getCredits()) {
            entries.add(createEntry(transactionId, credit, EntryType.CREDIT));
        }
        net.forEach((account, delta) -> balances.merge(account, delta, BigInteger::add));
        transactions.put(transactionId, List.copyOf(entries));

        log.debug("Posted ledger transaction {}: {} entries, total={}",
            transactionId, entries.size(), request.getDebitTotal());
        return transactionId;
    }

    /**
     * Convenience for a single transfer between two accounts.
     */
    public UUID transfer(Address from, Address to, BigInteger amount, String description) {
        return postTransaction(TransactionRequest.transfer(description, from, to, amount));
    }

    /**
     * Issues new funds to an account.
     */
    public UUID issue(Address to, BigInteger amount, String description) {
        return transfer(ISSUER, to, amount, description);
    }

    /**
     * Removes the most recent transaction and restores the balances it changed.
     *
     * @throws IllegalStateException if the transaction is not the latest one
     */
    public void revert(UUID transactionId) {
        UUID latest = null;
        for (UUID id : transactions.keySet()) {
            latest = id;
        }
        if (latest == null || !latest.equals(transactionId)) {
            throw new IllegalStateException("Only the latest transaction can be reverted: " + transactionId);
        }
        List<LedgerEntry> entries = transactions.remove(transactionId);
        for (LedgerEntry entry : entries) {
            BigInteger delta = entry.getEntryType() == EntryType.CREDIT
                ? entry.getAmount().negate()
                : entry.getAmount();
            balances.merge(entry.getAccount(), delta, BigInteger::add);
        }
        nextSequence -= entries.size();
        log.debug("Reverted ledger transaction {}", transactionId);
    }

    /**
     * Gets the balance for an account. Unknown accounts have a zero balance.
     */
    public BigInteger getBalance(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * Gets all ledger entries for a transaction, in posting order.
     */
    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return transactions.getOrDefault(transactionId, List.of());
    }

    public int getTransactionCount() {
        return transactions.size();
    }

    /**
     * Sum of all balances. Zero whenever every posted transaction was balanced.
     */
    public BigInteger getTotalBalance() {
        return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    private LedgerEntry createEntry(UUID transactionId, TransactionRequest.DebitCredit leg, EntryType type) {
        return new LedgerEntry(
            UUID.randomUUID(),
            transactionId,
            leg.getAccount(),
            leg.getAmount(),
            type,
            leg.getDescription(),
            nextSequence++
        );
    }

    private static Map<Address, BigInteger> netMovements(TransactionRequest request) {
        Map<Address, BigInteger> net = new LinkedHashMap<>();
        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            net.merge(debit.getAccount(), debit.getAmount().negate(), BigInteger::add);
        }
        for (TransactionRequest.DebitCredit credit : request.getCredits()) {
            net.merge(credit.getAccount(), credit.getAmount(), BigInteger::add);
        }
        return net;
    }
}
