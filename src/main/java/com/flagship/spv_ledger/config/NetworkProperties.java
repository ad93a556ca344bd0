package com.flagship.spv_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Network parameters bound from {@code spv.network.*} in application.yml.
 *
 * Milestones describe height-dependent constants. A milestone applies from its
 * height until the next milestone takes over.
 */
@Data
@ConfigurationProperties(prefix = "spv.network")
public class NetworkProperties {

    /**
     * Address version byte prepended to the RIPEMD-160 hash of a public key.
     * 23 produces mainnet "A..." addresses, 30 produces devnet "D..." addresses.
     */
    private int pubKeyHash = 23;

    private List<Milestone> milestones = new ArrayList<>();

    /**
     * Wallets seeded before every rebuild. They may legitimately end with a negative balance.
     */
    private List<GenesisWallet> genesisWallets = new ArrayList<>();

    @Data
    public static class Milestone {
        private long height;
        private int activeDelegates;
    }

    @Data
    public static class GenesisWallet {
        private String address;
        private String publicKey;
    }
}
