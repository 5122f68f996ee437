package com.flagship.nft_marketplace.config;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.ledger.BalanceLedger;
import com.flagship.nft_marketplace.marketplace.InMemoryTokenRegistry;
import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
import com.flagship.nft_marketplace.receipt.LedgerRecovery;
import com.flagship.nft_marketplace.receipt.ReceiptRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.Map;

/**
 * Builds the marketplace ledger at startup.
 *
 * Order matters: genesis balances are issued, the marketplace is deployed,
 * stored receipts are replayed, and only then is the receipt recorder attached.
 */
@Configuration
@EnableConfigurationProperties(MarketplaceProperties.class)
@Slf4j
public class MarketplaceConfig {

    @Bean
    public BalanceLedger balanceLedger(MarketplaceProperties properties) {
        BalanceLedger balances = new BalanceLedger();
        for (Map.Entry<String, BigInteger> entry : properties.getInitialBalances().entrySet()) {
            Address account = Address.of(entry.getKey());
            balances.issue(account, entry.getValue(), "Genesis balance");
            log.info("Issued genesis balance: account={}, amount={}", account, entry.getValue());
        }
        return balances;
    }

    @Bean
    public MarketplaceLedger marketplaceLedger(MarketplaceProperties properties,
                                               BalanceLedger balanceLedger,
                                               LedgerRecovery recovery,
                                               ReceiptRecorder receiptRecorder) {
        MarketplaceLedger ledger = new MarketplaceLedger(
                properties.toDeployment(), new InMemoryTokenRegistry(), balanceLedger);

        int replayed = recovery.replay(ledger);
        ledger.addTransactionObserver(receiptRecorder);

        log.info("Marketplace ledger ready: replayed={}, sequence={}", replayed, ledger.getSequenceNumber());
        return ledger;
    }
}
