package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.config.MarketplaceProperties;
import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.observability.CorrelationContext;
import com.flagship.nft_marketplace.observability.MarketplaceMetrics;
import com.flagship.nft_marketplace.receipt.IdempotencyService;
import com.flagship.nft_marketplace.receipt.ReceiptPersistenceService;
import com.flagship.nft_marketplace.receipt.ReceiptRecorder;
import com.flagship.nft_marketplace.receipt.TransactionReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Application service in front of the {@link MarketplaceLedger}.
 *
 * Writes open no transaction of their own. The {@link ReceiptRecorder}
 * observer writes the receipt and outbox events and commits them from inside
 * the ledger's atomic scope, so a failed insert or commit rolls the ledger back
 * as well, and the ledger never runs ahead of the receipts table.
 *
 * Writes take an optional idempotency key. A key that was already used
 * returns the stored receipt and leaves the ledger untouched. The key is cached
 * in Redis only once its receipt is committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketplaceService {

    private final MarketplaceLedger ledger;
    private final ReceiptRecorder receiptRecorder;
    private final ReceiptPersistenceService receiptPersistence;
    private final IdempotencyService idempotencyService;
    private final MarketplaceMetrics metrics;
    private final MarketplaceProperties properties;

    // ==================== Writes ====================

    public OperationResult purchase(long tokenId, String buyer, BigInteger value, String idempotencyKey) {
        OperationResult result = execute("purchase", tokenId, buyer, idempotencyKey,
            () -> ledger.buyToken(parseAddress(buyer), tokenId, value));
        if (!result.isReplayed()) {
            metrics.recordPurchaseVolume(value);
        }
        return result;
    }

    public OperationResult relist(long tokenId, String seller, BigInteger price, BigInteger value,
                                  String idempotencyKey) {
        return execute("relist", tokenId, seller, idempotencyKey,
            () -> ledger.resellToken(parseAddress(seller), tokenId, price, value));
    }

    public OperationResult transferToken(long tokenId, String from, String to, String idempotencyKey) {
        return execute("transfer", tokenId, from, idempotencyKey,
            () -> ledger.transferToken(parseAddress(from), parseAddress(to), tokenId));
    }

    public OperationResult updateRoyaltyFee(String caller, BigInteger fee, String idempotencyKey) {
        return execute("royalty_fee", null, caller, idempotencyKey,
            () -> ledger.updateRoyaltyFee(parseAddress(caller), fee));
    }

    public OperationResult transferOwnership(String caller, String newOwner, String idempotencyKey) {
        return execute("ownership", null, caller, idempotencyKey,
            () -> ledger.transferOwnership(parseAddress(caller), parseAddress(newOwner)));
    }

    /**
     * Development faucet.
     *
     * @throws MarketplaceException AUTHORIZATION when funding is disabled
     */
    public OperationResult fund(String account, BigInteger amount, String idempotencyKey) {
        if (!properties.getFunding().isEnabled()) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION, "Funding is disabled");
        }
        return execute("funding", null, account, idempotencyKey,
            () -> ledger.depositFunds(parseAddress(account), amount));
    }

    // ==================== Reads ====================

    public MarketplaceLedger getLedger() {
        return ledger;
    }

    public MarketItem getItem(long tokenId) {
        return ledger.getItem(tokenId);
    }

    public List<MarketItem> getUnsoldItems() {
        return ledger.getUnsoldTokens();
    }

    public List<MarketItem> getOwnedItems(String owner) {
        return ledger.getOwnedTokens(parseAddress(owner));
    }

    public long tokenCount(String account) {
        return ledger.balanceOf(parseAddress(account));
    }

    public BigInteger funds(String account) {
        return ledger.fundsOf(parseAddress(account));
    }

    public Address ownerOf(long tokenId) {
        return ledger.ownerOf(tokenId);
    }

    public String tokenUri(long tokenId) {
        return ledger.tokenUri(tokenId);
    }

    @Transactional(readOnly = true)
    public Optional<TransactionReceipt> getReceipt(long sequenceNumber) {
        return receiptPersistence.findBySequenceNumber(sequenceNumber);
    }

    /**
     * Every committed purchase, relisting and transfer of one token, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionReceipt> getTokenHistory(long tokenId) {
        ledger.getItem(tokenId);
        return receiptPersistence.findByTokenId(tokenId);
    }

    // ==================== Internals ====================

    private OperationResult execute(String operation, Long tokenId, String caller, String idempotencyKey,
                                    Supplier<LedgerTransaction> action) {
        long startTime = System.currentTimeMillis();
        if (tokenId != null) {
            MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, tokenId.toString());
        }
        MDC.put(CorrelationContext.CALLER_MDC_KEY, caller);

        try {
            if (idempotencyKey != null) {
                Optional<Long> existing = idempotencyService.checkIdempotencyKey(idempotencyKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning receipt #{}", existing.get());
                    TransactionReceipt receipt = receiptPersistence.findBySequenceNumber(existing.get())
                        .orElseThrow(() -> new IllegalStateException(
                            "Receipt found by idempotency key but not by sequence number: " + existing.get()));
                    return new OperationResult(receipt, true);
                }
                metrics.recordIdempotencyMiss();
            }

            LedgerTransaction transaction = receiptRecorder.withIdempotencyKey(idempotencyKey, action);
            TransactionReceipt receipt = receiptPersistence.findBySequenceNumber(transaction.getSequenceNumber())
                .orElseThrow(() -> new IllegalStateException(
                    "Receipt #" + transaction.getSequenceNumber() + " was not recorded"));

            if (idempotencyKey != null) {
                idempotencyService.storeIdempotencyKey(idempotencyKey, receipt.getSequenceNumber());
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            metrics.recordLatency(operation, duration);
            log.info("Operation {} committed as #{} in {}ms", operation, receipt.getSequenceNumber(), duration);
            return new OperationResult(receipt, false);

        } catch (MarketplaceException e) {
            metrics.recordOperation(operation, e.getKind().name().toLowerCase());
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            log.warn("Operation {} rejected: kind={}, reason={}", operation, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            log.error("Operation {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CALLER_MDC_KEY);
        }
    }

    private static Address parseAddress(String value) {
        try {
            return Address.of(value);
        } catch (IllegalArgumentException e) {
            throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, e.getMessage(), e);
        }
    }
}
