package com.flagship.spv_ledger.config;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves height-dependent network constants from the configured milestones.
 */
@Component
public class NetworkConstants {

    private final List<NetworkProperties.Milestone> milestones;
    private final Set<String> genesisAddresses;
    private final int pubKeyHash;

    public NetworkConstants(NetworkProperties properties) {
        if (properties.getMilestones().isEmpty()) {
            throw new IllegalStateException("At least one network milestone must be configured (spv.network.milestones)");
        }
        this.milestones = properties.getMilestones().stream()
            .sorted(Comparator.comparingLong(NetworkProperties.Milestone::getHeight))
            .toList();
        this.genesisAddresses = properties.getGenesisWallets().stream()
            .map(NetworkProperties.GenesisWallet::getAddress)
            .collect(Collectors.toUnmodifiableSet());
        this.pubKeyHash = properties.getPubKeyHash();
    }

    /**
     * Number of delegates allowed to forge at the given height.
     * Heights below the first milestone use the first milestone.
     */
    public int getActiveDelegates(long height) {
        NetworkProperties.Milestone current = milestones.get(0);
        for (NetworkProperties.Milestone milestone : milestones) {
            if (milestone.getHeight() > height) {
                break;
            }
            current = milestone;
        }
        if (current.getActiveDelegates() <= 0) {
            throw new IllegalStateException(
                String.format("Milestone at height %d declares %d active delegates",
                    current.getHeight(), current.getActiveDelegates()));
        }
        return current.getActiveDelegates();
    }

    public Set<String> getGenesisAddresses() {
        return genesisAddresses;
    }

    public int getPubKeyHash() {
        return pubKeyHash;
    }
}
