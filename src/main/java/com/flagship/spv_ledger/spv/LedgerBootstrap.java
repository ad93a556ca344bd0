package com.flagship.spv_ledger.spv;

import com.flagship.spv_ledger.config.NetworkProperties;
import com.flagship.spv_ledger.history.BlockRepository;
import com.flagship.spv_ledger.history.WalletSnapshot;
import com.flagship.spv_ledger.history.WalletSnapshotRepository;
import com.flagship.spv_ledger.ledger.WalletManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds the ledger once the application has started.
 *
 * {@code spv.bootstrap.enabled=false} skips the startup pass; {@link #rebuild()} stays
 * callable. A failed startup rebuild fails startup.
 */
@Component
@Slf4j
public class LedgerBootstrap implements ApplicationRunner {

    private final WalletManager walletManager;
    private final NetworkProperties networkProperties;
    private final WalletSnapshotRepository walletSnapshotRepository;
    private final BlockRepository blockRepository;
    private final SpvRebuildService rebuildService;
    private final boolean enabled;

    public LedgerBootstrap(WalletManager walletManager,
                           NetworkProperties networkProperties,
                           WalletSnapshotRepository walletSnapshotRepository,
                           BlockRepository blockRepository,
                           SpvRebuildService rebuildService,
                           @Value("${spv.bootstrap.enabled:true}") boolean enabled) {
        this.walletManager = walletManager;
        this.networkProperties = networkProperties;
        this.walletSnapshotRepository = walletSnapshotRepository;
        this.blockRepository = blockRepository;
        this.rebuildService = rebuildService;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Ledger bootstrap disabled, skipping startup rebuild");
            return;
        }
        rebuild();
    }

    /**
     * Clears the wallet store, seeds the genesis and snapshot wallets and rebuilds up to the
     * last persisted block. Safe to call repeatedly.
     */
    public RebuildResult rebuild() {
        walletManager.reset();

        for (NetworkProperties.GenesisWallet genesis : networkProperties.getGenesisWallets()) {
            walletManager.seed(genesis.getAddress(), genesis.getPublicKey());
        }
        List<WalletSnapshot> snapshots = walletSnapshotRepository.findAll();
        for (WalletSnapshot snapshot : snapshots) {
            walletManager.seed(snapshot.getAddress(), snapshot.getPublicKey());
        }
        log.info("Seeded {} genesis and {} snapshot wallets",
            networkProperties.getGenesisWallets().size(), snapshots.size());

        long height = blockRepository.findLastHeight();
        try {
            return rebuildService.build(height);
        } catch (RebuildException e) {
            log.error("Ledger bootstrap failed at height {}", height, e);
            throw e;
        }
    }
}
