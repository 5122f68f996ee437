package com.flagship.nft_marketplace.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * A single debit or credit entry in the balance ledger.
 *
 * Key invariant: All transactions must have balanced debits and credits.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    Address account;
    BigInteger amount;
    EntryType entryType;
    String description;
    long sequenceNumber;
}
