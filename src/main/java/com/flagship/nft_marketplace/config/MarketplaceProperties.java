package com.flagship.nft_marketplace.config;

import com.flagship.nft_marketplace.ledger.Address;
import com.flagship.nft_marketplace.marketplace.MarketplaceDeployment;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment parameters of the marketplace, bound from {@code marketplace.*}.
 *
 * All amounts are in wei.
 */
@ConfigurationProperties(prefix = "marketplace")
@Getter
@Setter
public class MarketplaceProperties {

    private String contractAddress;
    private String deployer;
    private String artist;
    private BigInteger royaltyFee = BigInteger.ZERO;
    private List<BigInteger> prices = new ArrayList<>();
    private BigInteger deposit = BigInteger.ZERO;
    private String name = "MusicNFTs";
    private String symbol = "MNS";
    private String baseUri = "";

    /** Balances issued before deployment, keyed by address. */
    private Map<String, BigInteger> initialBalances = new LinkedHashMap<>();

    private Funding funding = new Funding();

    @Getter
    @Setter
    public static class Funding {
        /** Enables the development faucet endpoint. */
        private boolean enabled = false;
    }

    /**
     * @throws IllegalArgumentException if an address is missing or malformed
     */
    public MarketplaceDeployment toDeployment() {
        return MarketplaceDeployment.builder()
                .address(Address.of(contractAddress))
                .deployer(Address.of(deployer))
                .artist(Address.of(artist))
                .royaltyFee(royaltyFee)
                .prices(List.copyOf(prices))
                .deposit(deposit)
                .name(name)
                .symbol(symbol)
                .baseUri(baseUri)
                .build();
    }
}
