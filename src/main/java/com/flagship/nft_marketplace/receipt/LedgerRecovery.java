package com.flagship.nft_marketplace.receipt;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.marketplace.LedgerTransaction;
import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds ledger state at startup by replaying stored receipts.
 *
 * The ledger is deterministic: the same deployment plus the same operations in
 * the same order yields the same state. Replay must happen before any observer
 * is attached, otherwise every replayed operation would be recorded again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerRecovery {

    private final ReceiptPersistenceService persistenceService;

    /**
     * @return number of receipts replayed
     * @throws IllegalStateException if a receipt cannot be applied or lands on a
     *         different sequence number than the one it was stored under
     */
    public int replay(MarketplaceLedger ledger) {
        List<TransactionReceipt> receipts = persistenceService.findAllInOrder();
        if (receipts.isEmpty()) {
            log.info("No receipts to replay, starting from deployment state");
            return 0;
        }

        log.info("Replaying {} receipt(s)", receipts.size());
        for (TransactionReceipt receipt : receipts) {
            LedgerTransaction applied;
            try {
                applied = apply(ledger, receipt);
            } catch (RuntimeException e) {
                throw new IllegalStateException(
                    "Failed to replay receipt #" + receipt.getSequenceNumber() + ": " + e.getMessage(), e);
            }
            if (applied.getSequenceNumber() != receipt.getSequenceNumber()) {
                throw new IllegalStateException(String.format(
                    "Replay diverged: receipt #%d was applied as #%d",
                    receipt.getSequenceNumber(), applied.getSequenceNumber()));
            }
        }

        List<String> violations = ledger.verifyInvariants();
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Ledger invariants violated after replay: " + violations);
        }
        log.info("Replay complete at sequence #{}", ledger.getSequenceNumber());
        return receipts.size();
    }

    private static LedgerTransaction apply(MarketplaceLedger ledger, TransactionReceipt receipt) {
        return switch (receipt.getType()) {
            case PURCHASE -> ledger.buyToken(
                Address.of(receipt.getCaller()), receipt.getTokenId(), receipt.getValue());
            case RELIST -> ledger.resellToken(
                Address.of(receipt.getCaller()), receipt.getTokenId(), receipt.getAmount(), receipt.getValue());
            case TOKEN_TRANSFER -> ledger.transferToken(
                Address.of(receipt.getCaller()), Address.of(receipt.getCounterparty()), receipt.getTokenId());
            case ROYALTY_FEE_UPDATE -> ledger.updateRoyaltyFee(
                Address.of(receipt.getCaller()), receipt.getAmount());
            case OWNERSHIP_TRANSFER -> ledger.transferOwnership(
                Address.of(receipt.getCaller()), Address.of(receipt.getCounterparty()));
            case FUNDING -> ledger.depositFunds(
                Address.of(receipt.getCounterparty()), receipt.getAmount());
        };
    }
}
