package com.flagship.nft_marketplace.receipt;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.ledger.BalanceLedger;
import com.flagship.nft_marketplace.marketplace.InMemoryTokenRegistry;
import com.flagship.nft_marketplace.marketplace.LedgerTransaction;
import com.flagship.nft_marketplace.marketplace.MarketItem;
import com.flagship.nft_marketplace.marketplace.MarketplaceDeployment;
import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
import com.flagship.nft_marketplace.marketplace.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Replaying the receipts of one ledger onto a freshly deployed one must
 * reproduce its state exactly.
 */
class LedgerRecoveryTest {

    private static final BigInteger FEE = BigInteger.valueOf(10);
    private static final Address MARKETPLACE = Address.of("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    private static final Address DEPLOYER = Address.of("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    private static final Address ARTIST = Address.of("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
    private static final Address ALICE = Address.of("0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc");
    private static final Address BOB = Address.of("0x90f79bf6eb2c4f870365e785982e1f101e93b906");

    private ReceiptPersistenceService persistenceService;
    private LedgerRecovery recovery;

    @BeforeEach
    void setUp() {
        persistenceService = mock(ReceiptPersistenceService.class);
        recovery = new LedgerRecovery(persistenceService);
    }

    private static MarketplaceLedger deploy() {
        BalanceLedger balances = new BalanceLedger();
        balances.issue(DEPLOYER, BigInteger.valueOf(1_000), "Genesis");
        return new MarketplaceLedger(MarketplaceDeployment.builder()
                .address(MARKETPLACE)
                .deployer(DEPLOYER)
                .artist(ARTIST)
                .royaltyFee(FEE)
                .prices(List.of(BigInteger.valueOf(100), BigInteger.valueOf(200), BigInteger.valueOf(300)))
                .deposit(BigInteger.valueOf(30))
                .name("MusicNFTs")
                .symbol("MNS")
                .baseUri("")
                .build(),
            new InMemoryTokenRegistry(), balances);
    }

    private static TransactionReceipt stored(LedgerTransaction transaction) {
        TransactionReceipt receipt = TransactionReceipt.of(transaction, null);
        return new TransactionReceipt(receipt.getSequenceNumber(), receipt.getType(), receipt.getCaller(),
            receipt.getTokenId(), receipt.getValue(), receipt.getAmount(), receipt.getCounterparty(),
            null, Instant.now());
    }

    @Test
    @DisplayName("Replay rebuilds balances, ownership, listings, fee and owner")
    void testReplayReproducesState() {
        // Given: a history covering every operation type
        MarketplaceLedger original = deploy();
        List<TransactionReceipt> receipts = new ArrayList<>();
        original.addTransactionObserver(transaction -> receipts.add(stored(transaction)));

        original.depositFunds(ALICE, BigInteger.valueOf(500));
        original.depositFunds(BOB, BigInteger.valueOf(500));
        original.buyToken(ALICE, 1, BigInteger.valueOf(200));
        original.resellToken(ALICE, 1, BigInteger.valueOf(250), FEE);
        original.buyToken(BOB, 1, BigInteger.valueOf(250));
        original.buyToken(ALICE, 2, BigInteger.valueOf(300));
        original.transferToken(ALICE, BOB, 2);
        original.updateRoyaltyFee(DEPLOYER, BigInteger.valueOf(5));
        original.transferOwnership(DEPLOYER, BOB);
        when(persistenceService.findAllInOrder()).thenReturn(receipts);

        // When
        MarketplaceLedger rebuilt = deploy();
        int replayed = recovery.replay(rebuilt);

        // Then
        assertEquals(9, replayed);
        assertEquals(original.getSequenceNumber(), rebuilt.getSequenceNumber());
        assertEquals(original.getUnsoldTokens(), rebuilt.getUnsoldTokens());
        for (long tokenId = 0; tokenId < 3; tokenId++) {
            MarketItem item = original.getItem(tokenId);
            assertEquals(item, rebuilt.getItem(tokenId));
            assertEquals(original.ownerOf(tokenId), rebuilt.ownerOf(tokenId));
        }
        for (Address account : List.of(MARKETPLACE, DEPLOYER, ARTIST, ALICE, BOB)) {
            assertEquals(original.fundsOf(account), rebuilt.fundsOf(account), "funds of " + account);
        }
        assertEquals(original.getRoyaltyFee(), rebuilt.getRoyaltyFee());
        assertEquals(BOB, rebuilt.getOwner());
        assertEquals(List.of(), rebuilt.verifyInvariants());
    }

    @Test
    @DisplayName("No receipts leaves the deployment state untouched")
    void testEmptyHistory() {
        when(persistenceService.findAllInOrder()).thenReturn(List.of());
        MarketplaceLedger ledger = deploy();

        assertEquals(0, recovery.replay(ledger));
        assertEquals(0, ledger.getSequenceNumber());
        assertEquals(3, ledger.getUnsoldTokens().size());
    }

    @Test
    @DisplayName("A receipt the ledger rejects aborts recovery")
    void testRejectedReceipt() {
        TransactionReceipt doubleBuy = new TransactionReceipt(1, TransactionType.PURCHASE, ALICE.toString(),
            0L, BigInteger.valueOf(100), BigInteger.valueOf(100), DEPLOYER.toString(), null, Instant.now());
        when(persistenceService.findAllInOrder()).thenReturn(List.of(doubleBuy));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> recovery.replay(deploy()));
        assertTrue(e.getMessage().contains("#1"));
    }

    @Test
    @DisplayName("A gap in the receipt sequence is detected")
    void testSequenceGap() {
        TransactionReceipt funding = new TransactionReceipt(2, TransactionType.FUNDING,
            BalanceLedger.ISSUER.toString(), null, BigInteger.ZERO, BigInteger.valueOf(5), ALICE.toString(),
            null, Instant.now());
        when(persistenceService.findAllInOrder()).thenReturn(List.of(funding));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> recovery.replay(deploy()));
        assertTrue(e.getMessage().contains("diverged"));
    }
}
