package com.flagship.nft_marketplace.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the balance ledger: imbalanced postings, overdrafts and
 * out-of-order reverts must all be refused without changing any balance.
 */
class BalanceLedgerTest {

    private static final Address ALICE = Address.of("0x1000000000000000000000000000000000000001");
    private static final Address BOB = Address.of("0x2000000000000000000000000000000000000002");
    private static final Address CAROL = Address.of("0x3000000000000000000000000000000000000003");

    private BalanceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new BalanceLedger();
        ledger.issue(ALICE, BigInteger.valueOf(1_000), "Initial funding");
    }

    @Test
    @DisplayName("Issuing funds debits the issuer and keeps the ledger balanced")
    void testIssue() {
        assertEquals(BigInteger.valueOf(1_000), ledger.getBalance(ALICE));
        assertEquals(BigInteger.valueOf(-1_000), ledger.getBalance(BalanceLedger.ISSUER));
        assertEquals(BigInteger.ZERO, ledger.getTotalBalance());
    }

    @Test
    @DisplayName("Valid transfer should move funds and write one debit and one credit")
    void testValidTransfer() {
        // When
        UUID transactionId = ledger.transfer(ALICE, BOB, BigInteger.valueOf(400), "Payment");

        // Then
        assertEquals(BigInteger.valueOf(600), ledger.getBalance(ALICE));
        assertEquals(BigInteger.valueOf(400), ledger.getBalance(BOB));

        List<LedgerEntry> entries = ledger.getLedgerEntriesForTransaction(transactionId);
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(ALICE, entries.get(0).getAccount());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());
        assertEquals(BOB, entries.get(1).getAccount());
        assertTrue(entries.get(0).getSequenceNumber() < entries.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Imbalanced transaction should be rejected")
    void testImbalancedTransactionRejected() {
        TransactionRequest request = new TransactionRequest(
            "Imbalanced",
            List.of(TransactionRequest.DebitCredit.of(ALICE, BigInteger.valueOf(100), "Debit")),
            List.of(TransactionRequest.DebitCredit.of(BOB, BigInteger.valueOf(50), "Credit"))
        );

        assertThrows(IllegalArgumentException.class, () -> ledger.postTransaction(request));
        assertEquals(BigInteger.valueOf(1_000), ledger.getBalance(ALICE));
        assertEquals(BigInteger.ZERO, ledger.getBalance(BOB));
    }

    @Test
    @DisplayName("Empty transaction should be rejected")
    void testEmptyTransactionRejected() {
        TransactionRequest empty = new TransactionRequest.Builder("Nothing").build();

        assertTrue(empty.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ledger.postTransaction(empty));
    }

    @Test
    @DisplayName("Zero and negative amounts cannot form an entry")
    void testNonPositiveAmountRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRequest.DebitCredit.of(ALICE, BigInteger.ZERO, "Zero"));
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRequest.DebitCredit.of(ALICE, BigInteger.valueOf(-1), "Negative"));
    }

    @Test
    @DisplayName("Overdraft should fail with the account, balance and shortfall")
    void testOverdraftRejected() {
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> ledger.transfer(BOB, ALICE, BigInteger.ONE, "Bob has nothing"));

        assertEquals(BOB, e.getAccount());
        assertEquals(BigInteger.ZERO, e.getBalance());
        assertEquals(BigInteger.ONE, e.getRequired());
        assertEquals(1, ledger.getTransactionCount());
    }

    @Test
    @DisplayName("Multi-leg payment is checked on net movement per account")
    void testMultiLegNetting() {
        ledger.transfer(ALICE, BOB, BigInteger.valueOf(10), "Seed Bob");

        // Bob pays 100 he does not have, but receives 100 in the same transaction
        TransactionRequest request = new TransactionRequest.Builder("Pass-through")
            .move(ALICE, BOB, BigInteger.valueOf(100))
            .move(BOB, CAROL, BigInteger.valueOf(100))
            .move(BOB, CAROL, BigInteger.ZERO)
            .build();
        ledger.postTransaction(request);

        assertEquals(BigInteger.valueOf(890), ledger.getBalance(ALICE));
        assertEquals(BigInteger.valueOf(10), ledger.getBalance(BOB));
        assertEquals(BigInteger.valueOf(100), ledger.getBalance(CAROL));
        assertEquals(BigInteger.ZERO, ledger.getTotalBalance());
    }

    @Test
    @DisplayName("Reverting the latest transaction restores every balance")
    void testRevertLatest() {
        UUID transactionId = ledger.transfer(ALICE, BOB, BigInteger.valueOf(250), "To revert");

        ledger.revert(transactionId);

        assertEquals(BigInteger.valueOf(1_000), ledger.getBalance(ALICE));
        assertEquals(BigInteger.ZERO, ledger.getBalance(BOB));
        assertTrue(ledger.getLedgerEntriesForTransaction(transactionId).isEmpty());
        assertEquals(1, ledger.getTransactionCount());
    }

    @Test
    @DisplayName("Only the latest transaction can be reverted")
    void testRevertOutOfOrderRejected() {
        UUID first = ledger.transfer(ALICE, BOB, BigInteger.valueOf(1), "First");
        ledger.transfer(ALICE, BOB, BigInteger.valueOf(2), "Second");

        assertThrows(IllegalStateException.class, () -> ledger.revert(first));
        assertEquals(BigInteger.valueOf(3), ledger.getBalance(BOB));
    }
}
