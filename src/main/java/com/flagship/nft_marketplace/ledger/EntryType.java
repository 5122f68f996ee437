package com.flagship.nft_marketplace.ledger;

/**
 * Represents the type of ledger entry in double-entry accounting.
 * Every transaction must have balanced debits and credits.
 *
 * Balances are kept from the holder's side: a CREDIT adds funds to an
 * address, a DEBIT takes funds away from it.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
