package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.ledger.BalanceLedger;
import com.flagship.nft_marketplace.ledger.InsufficientFundsException;
import com.flagship.nft_marketplace.ledger.TransactionRequest;
import com.flagship.nft_marketplace.marketplace.event.MarketItemBoughtEvent;
import com.flagship.nft_marketplace.marketplace.event.MarketItemRelistedEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ledger of market items for a fixed token catalogue.
 *
 * This class enforces the core invariants:
 * 1. Every token id in 0..N has exactly one item and one owner
 * 2. An item is listed if and only if the ledger address owns its token
 * 3. A listed item has a positive price
 * 4. The royalty fee changes only through the owner
 * 5. N is fixed at construction
 *
 * Operations are serialized by one lock and are all-or-nothing: every
 * mutation is recorded in a {@link Journal} and undone if any later step of
 * the same operation fails. Listing state and token ownership are finalized
 * before payees are notified, and writes attempted from inside a payee or
 * observer callback are rejected.
 */
@Slf4j
public class MarketplaceLedger {

    private final Address address;
    private final Address artist;
    private final String name;
    private final String symbol;
    private final String baseUri;
    private final List<MarketItem> items;
    private final TokenRegistry registry;
    private final BalanceLedger balances;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<Address, PaymentReceiver> receivers = new ConcurrentHashMap<>();
    private final List<TransactionObserver> observers = new CopyOnWriteArrayList<>();

    private BigInteger royaltyFee;
    private Address owner;
    private long sequenceNumber;

    /**
     * Deploys the marketplace: takes the deposit from the deployer, mints one
     * token per price into escrow and lists each at its price with the deployer as seller.
     *
     * @throws MarketplaceException if the deposit does not cover one royalty fee
     *         per token, a price is not positive, or the deployer cannot pay the deposit
     */
    public MarketplaceLedger(MarketplaceDeployment deployment, TokenRegistry registry, BalanceLedger balances) {
        this.address = requireAddress(deployment.getAddress(), "Ledger address");
        this.artist = requireAddress(deployment.getArtist(), "Artist");
        Address deployer = requireAddress(deployment.getDeployer(), "Deployer");
        if (deployer.equals(BalanceLedger.ISSUER)) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION, "The issuance account cannot deploy the marketplace");
        }
        this.name = deployment.getName();
        this.symbol = deployment.getSymbol();
        this.baseUri = deployment.getBaseUri() != null ? deployment.getBaseUri() : "";
        this.registry = registry;
        this.balances = balances;

        BigInteger fee = deployment.getRoyaltyFee();
        if (fee == null || fee.signum() < 0) {
            throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "Royalty fee must not be negative");
        }
        List<BigInteger> prices = deployment.getPrices() != null ? deployment.getPrices() : List.of();
        for (int i = 0; i < prices.size(); i++) {
            if (prices.get(i) == null || prices.get(i).signum() <= 0) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT,
                    String.format("Non-positive price for token %d: %s", i, prices.get(i)));
            }
        }
        BigInteger deposit = deployment.getDeposit() != null ? deployment.getDeposit() : BigInteger.ZERO;
        BigInteger required = fee.multiply(BigInteger.valueOf(prices.size()));
        if (deposit.compareTo(required) < 0) {
            throw new MarketplaceException(ErrorKind.PAYMENT_MISMATCH,
                String.format("Insufficient deposit: required=%s, sent=%s", required, deposit));
        }
        if (registry.totalSupply() != 0) {
            throw new IllegalArgumentException("Token registry must be empty at deployment");
        }

        // The deposit is the only step that can fail, so it goes first
        if (deposit.signum() > 0) {
            try {
                balances.transfer(deployer, address, deposit, "Deployment deposit");
            } catch (InsufficientFundsException e) {
                throw new MarketplaceException(ErrorKind.INSUFFICIENT_FUNDS, e.getMessage(), e);
            }
        }

        List<MarketItem> catalogue = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            registry.mint(i, address);
            catalogue.add(new MarketItem(i, deployer, prices.get(i)));
        }
        this.items = catalogue;
        this.royaltyFee = fee;
        this.owner = deployer;

        log.info("Marketplace {} deployed at {}: tokens={}, royaltyFee={}, artist={}, owner={}",
            name, address, prices.size(), fee, artist, deployer);
    }

    // ==================== Write Operations ====================

    /**
     * Buys a listed token at exactly its asking price.
     *
     * The buyer pays the price into the ledger, the ledger pays the royalty fee to
     * the artist and the full price to the seller, and the token moves to the buyer.
     *
     * @throws MarketplaceException PAYMENT_MISMATCH if value differs from the price,
     *         STATE_INTEGRITY if the token is not listed
     */
    public LedgerTransaction buyToken(Address buyer, long tokenId, BigInteger value) {
        requireExternalCaller(buyer);
        return execute(journal -> {
            int index = checkTokenId(tokenId);
            MarketItem item = items.get(index);
            if (value == null || value.compareTo(item.getPrice()) != 0) {
                throw new MarketplaceException(ErrorKind.PAYMENT_MISMATCH,
                    "Please send the asking price in order to complete the purchase");
            }
            if (!item.isListed()) {
                throw new MarketplaceException(ErrorKind.STATE_INTEGRITY,
                    "Token " + tokenId + " is not listed for sale");
            }
            Address seller = item.getSeller();
            BigInteger price = item.getPrice();
            long sequence = nextSequence(journal);

            replaceItem(journal, index, item.unlist());
            moveToken(journal, tokenId, address, buyer);
            post(journal, new TransactionRequest.Builder("Purchase of token " + tokenId)
                .move(buyer, address, value)
                .move(address, artist, royaltyFee)
                .move(address, seller, value)
                .build());

            notifyReceiver(artist, royaltyFee);
            notifyReceiver(seller, value);

            log.info("Token {} bought: seller={}, buyer={}, price={}, royaltyFee={}",
                tokenId, seller, buyer, price, royaltyFee);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.PURCHASE)
                .caller(buyer)
                .tokenId(tokenId)
                .value(value)
                .amount(price)
                .counterparty(seller)
                .event(MarketItemBoughtEvent.of(sequence, tokenId, seller.toString(), buyer.toString(), price))
                .build();
        });
    }

    /**
     * Returns an owned token to escrow with a new asking price.
     *
     * The attached royalty fee stays in the ledger balance.
     *
     * @throws MarketplaceException INVALID_ARGUMENT if the price is not positive,
     *         PAYMENT_MISMATCH if value differs from the royalty fee,
     *         AUTHORIZATION if the relister does not own the token
     */
    public LedgerTransaction resellToken(Address relister, long tokenId, BigInteger newPrice, BigInteger value) {
        requireExternalCaller(relister);
        return execute(journal -> {
            int index = checkTokenId(tokenId);
            if (newPrice == null || newPrice.signum() <= 0) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT,
                    "Please set a Positive Number as the price of the item");
            }
            if (value == null || value.compareTo(royaltyFee) != 0) {
                throw new MarketplaceException(ErrorKind.PAYMENT_MISMATCH,
                    "Please send the required Royalty Fee in order to relist the item on Marketplace");
            }
            requireTokenOwner(relister, tokenId);
            long sequence = nextSequence(journal);

            moveToken(journal, tokenId, relister, address);
            replaceItem(journal, index, items.get(index).relist(relister, newPrice));
            post(journal, new TransactionRequest.Builder("Relisting of token " + tokenId)
                .move(relister, address, value)
                .build());

            log.info("Token {} relisted: seller={}, price={}", tokenId, relister, newPrice);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.RELIST)
                .caller(relister)
                .tokenId(tokenId)
                .value(value)
                .amount(newPrice)
                .event(MarketItemRelistedEvent.of(sequence, tokenId, relister.toString(), newPrice))
                .build();
        });
    }

    /**
     * Moves a privately held token to another holder. The token stays unlisted.
     *
     * @throws MarketplaceException AUTHORIZATION if the caller does not own the token,
     *         INVALID_ARGUMENT if the recipient is the zero address, the issuance account or the ledger itself
     */
    public LedgerTransaction transferToken(Address caller, Address to, long tokenId) {
        requireExternalCaller(caller);
        return execute(journal -> {
            checkTokenId(tokenId);
            if (to == null || to.isZero() || to.equals(address)) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT,
                    "Tokens can only be returned to the marketplace by relisting them");
            }
            if (to.equals(BalanceLedger.ISSUER)) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "The issuance account cannot hold tokens");
            }
            requireTokenOwner(caller, tokenId);
            long sequence = nextSequence(journal);

            moveToken(journal, tokenId, caller, to);

            log.info("Token {} transferred: from={}, to={}", tokenId, caller, to);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.TOKEN_TRANSFER)
                .caller(caller)
                .tokenId(tokenId)
                .value(BigInteger.ZERO)
                .counterparty(to)
                .build();
        });
    }

    /**
     * @throws MarketplaceException AUTHORIZATION if the caller is not the owner
     */
    public LedgerTransaction updateRoyaltyFee(Address caller, BigInteger newFee) {
        return execute(journal -> {
            requireOwner(caller);
            if (newFee == null || newFee.signum() < 0) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "Royalty fee must not be negative");
            }
            long sequence = nextSequence(journal);
            BigInteger previous = royaltyFee;
            royaltyFee = newFee;
            journal.record(() -> royaltyFee = previous);

            log.info("Royalty fee updated: {} -> {}", previous, newFee);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.ROYALTY_FEE_UPDATE)
                .caller(caller)
                .value(BigInteger.ZERO)
                .amount(newFee)
                .build();
        });
    }

    /**
     * @throws MarketplaceException AUTHORIZATION if the caller is not the owner
     */
    public LedgerTransaction transferOwnership(Address caller, Address newOwner) {
        return execute(journal -> {
            requireOwner(caller);
            if (newOwner == null || newOwner.isZero()) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "New owner is the zero address");
            }
            if (newOwner.equals(BalanceLedger.ISSUER)) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "The issuance account cannot own the marketplace");
            }
            long sequence = nextSequence(journal);
            Address previous = owner;
            owner = newOwner;
            journal.record(() -> owner = previous);

            log.info("Ownership transferred: {} -> {}", previous, newOwner);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.OWNERSHIP_TRANSFER)
                .caller(caller)
                .value(BigInteger.ZERO)
                .counterparty(newOwner)
                .build();
        });
    }

    /**
     * Issues new funds to an account.
     */
    public LedgerTransaction depositFunds(Address account, BigInteger amount) {
        return execute(journal -> {
            if (account == null || account.isZero() || account.equals(BalanceLedger.ISSUER)) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "Cannot fund " + account);
            }
            if (amount == null || amount.signum() <= 0) {
                throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "Funding amount must be positive");
            }
            long sequence = nextSequence(journal);
            UUID transactionId = balances.issue(account, amount, "Funding of " + account);
            journal.record(() -> balances.revert(transactionId));

            log.info("Funded {} with {}", account, amount);

            return LedgerTransaction.builder()
                .sequenceNumber(sequence)
                .type(TransactionType.FUNDING)
                .caller(BalanceLedger.ISSUER)
                .value(BigInteger.ZERO)
                .amount(amount)
                .counterparty(account)
                .build();
        });
    }

    // ==================== Queries ====================

    /**
     * Items currently listed for sale, in ascending token id order.
     */
    public List<MarketItem> getUnsoldTokens() {
        return read(() -> items.stream()
            .filter(MarketItem::isListed)
            .toList());
    }

    /**
     * Items whose token is owned by {@code who}, in ascending token id order.
     */
    public List<MarketItem> getOwnedTokens(Address who) {
        return read(() -> items.stream()
            .filter(item -> registry.ownerOf(item.getTokenId()).equals(who))
            .toList());
    }

    public MarketItem getItem(long tokenId) {
        return read(() -> items.get(checkTokenId(tokenId)));
    }

    public Address ownerOf(long tokenId) {
        return read(() -> {
            checkTokenId(tokenId);
            return registry.ownerOf(tokenId);
        });
    }

    /**
     * Number of tokens held by the account.
     */
    public long balanceOf(Address account) {
        return read(() -> registry.balanceOf(account));
    }

    /**
     * Currency balance of the account.
     */
    public BigInteger fundsOf(Address account) {
        return read(() -> balances.getBalance(account));
    }

    /**
     * Currency held by the ledger itself: the deployment deposit and relisting
     * fees, less royalties paid out on purchases.
     */
    public BigInteger contractBalance() {
        return fundsOf(address);
    }

    public String tokenUri(long tokenId) {
        checkTokenId(tokenId);
        return baseUri.isEmpty() ? "" : baseUri + tokenId;
    }

    public long totalSupply() {
        return items.size();
    }

    public BigInteger getRoyaltyFee() {
        return read(() -> royaltyFee);
    }

    public Address getOwner() {
        return read(() -> owner);
    }

    public long getSequenceNumber() {
        return read(() -> sequenceNumber);
    }

    public Address getAddress() {
        return address;
    }

    public Address getArtist() {
        return artist;
    }

    public String getName() {
        return name;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getBaseUri() {
        return baseUri;
    }

    /**
     * Checks the ledger invariants.
     *
     * @return descriptions of every violation found; empty when the ledger is consistent
     */
    public List<String> verifyInvariants() {
        return read(() -> {
            List<String> violations = new ArrayList<>();
            if (registry.totalSupply() != items.size()) {
                violations.add(String.format("Registry holds %d tokens, catalogue has %d",
                    registry.totalSupply(), items.size()));
            }
            for (int i = 0; i < items.size(); i++) {
                MarketItem item = items.get(i);
                if (item.getTokenId() != i) {
                    violations.add("Item at index " + i + " has token id " + item.getTokenId());
                }
                boolean escrowed = registry.ownerOf(i).equals(address);
                if (item.isListed() != escrowed) {
                    violations.add(String.format("Token %d: listed=%s but escrowed=%s", i, item.isListed(), escrowed));
                }
                if (item.isListed() && item.getPrice().signum() <= 0) {
                    violations.add("Token " + i + " is listed at a non-positive price");
                }
            }
            if (royaltyFee.signum() < 0) {
                violations.add("Royalty fee is negative");
            }
            if (balances.getTotalBalance().signum() != 0) {
                violations.add("Balance ledger does not sum to zero: " + balances.getTotalBalance());
            }
            return Collections.unmodifiableList(violations);
        });
    }

    // ==================== Callbacks ====================

    /**
     * Registers code to run when the ledger pays {@code payee}. Replaces any previous receiver.
     */
    public void registerPaymentReceiver(Address payee, PaymentReceiver receiver) {
        receivers.put(payee, receiver);
    }

    public void removePaymentReceiver(Address payee) {
        receivers.remove(payee);
    }

    public void addTransactionObserver(TransactionObserver observer) {
        observers.add(observer);
    }

    public void removeTransactionObserver(TransactionObserver observer) {
        observers.remove(observer);
    }

    // ==================== Internals ====================

    private LedgerTransaction execute(Function<Journal, LedgerTransaction> operation) {
        if (lock.isHeldByCurrentThread()) {
            throw new MarketplaceException(ErrorKind.STATE_INTEGRITY, "Reentrant call rejected");
        }
        lock.lock();
        Journal journal = new Journal();
        try {
            LedgerTransaction transaction = operation.apply(journal);
            for (TransactionObserver observer : observers) {
                observer.onTransaction(transaction);
            }
            return transaction;
        } catch (RuntimeException e) {
            journal.rollback(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private long nextSequence(Journal journal) {
        long previous = sequenceNumber;
        sequenceNumber = previous + 1;
        journal.record(() -> sequenceNumber = previous);
        return sequenceNumber;
    }

    private void replaceItem(Journal journal, int index, MarketItem replacement) {
        MarketItem previous = items.set(index, replacement);
        journal.record(() -> items.set(index, previous));
    }

    private void moveToken(Journal journal, long tokenId, Address from, Address to) {
        try {
            registry.transfer(tokenId, from, to);
        } catch (TokenTransferException e) {
            throw new MarketplaceException(ErrorKind.STATE_INTEGRITY, e.getMessage(), e);
        }
        journal.record(() -> registry.transfer(tokenId, to, from));
    }

    private void post(Journal journal, TransactionRequest request) {
        if (request.isEmpty()) {
            return;
        }
        UUID transactionId;
        try {
            transactionId = balances.postTransaction(request);
        } catch (InsufficientFundsException e) {
            throw new MarketplaceException(ErrorKind.INSUFFICIENT_FUNDS, e.getMessage(), e);
        }
        journal.record(() -> balances.revert(transactionId));
    }

    private void notifyReceiver(Address payee, BigInteger amount) {
        PaymentReceiver receiver = receivers.get(payee);
        if (receiver == null || amount.signum() == 0) {
            return;
        }
        try {
            receiver.onPayment(address, amount);
        } catch (MarketplaceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MarketplaceException(ErrorKind.STATE_INTEGRITY,
                "Payment to " + payee + " was rejected: " + e.getMessage(), e);
        }
    }

    private int checkTokenId(long tokenId) {
        if (tokenId < 0 || tokenId >= items.size()) {
            throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT,
                String.format("Token id %d is out of range [0, %d)", tokenId, items.size()));
        }
        return (int) tokenId;
    }

    private void requireOwner(Address caller) {
        if (caller == null || !caller.equals(owner)) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION, "Caller is not the owner");
        }
    }

    private void requireTokenOwner(Address caller, long tokenId) {
        Address current = registry.ownerOf(tokenId);
        if (!current.equals(caller)) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION,
                String.format("Caller %s does not own token %d", caller, tokenId));
        }
    }

    private void requireExternalCaller(Address caller) {
        if (caller == null || caller.isZero()) {
            throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, "Caller is the zero address");
        }
        if (caller.equals(address)) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION, "The marketplace cannot act as a caller");
        }
        if (caller.equals(BalanceLedger.ISSUER)) {
            throw new MarketplaceException(ErrorKind.AUTHORIZATION, "The issuance account cannot act as a caller");
        }
    }

    private static Address requireAddress(Address value, String role) {
        if (value == null || value.isZero()) {
            throw new MarketplaceException(ErrorKind.INVALID_ARGUMENT, role + " must be a non-zero address");
        }
        return value;
    }
}
