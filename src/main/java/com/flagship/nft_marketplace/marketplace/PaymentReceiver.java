package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;

import java.math.BigInteger;

/**
 * Code run on behalf of a payee when the ledger pays it.
 *
 * Receivers run inside the paying operation, after its bookkeeping is final.
 * Throwing aborts and rolls back that operation. A receiver may read the
 * ledger, but any write it attempts is rejected as reentrant.
 */
@FunctionalInterface
public interface PaymentReceiver {

    void onPayment(Address payer, BigInteger amount);
}
