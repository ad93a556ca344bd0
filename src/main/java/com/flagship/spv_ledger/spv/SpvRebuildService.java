package com.flagship.spv_ledger.spv;

import com.flagship.spv_ledger.config.NetworkConstants;
import com.flagship.spv_ledger.crypto.TransactionDecodeException;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.observability.RebuildMetrics;
import com.flagship.spv_ledger.spv.phase.BlockRewardsPhase;
import com.flagship.spv_ledger.spv.phase.DelegatesPhase;
import com.flagship.spv_ledger.spv.phase.LastForgedBlocksPhase;
import com.flagship.spv_ledger.spv.phase.MultiSignaturesPhase;
import com.flagship.spv_ledger.spv.phase.ReceivedTransfersPhase;
import com.flagship.spv_ledger.spv.phase.RebuildPhase;
import com.flagship.spv_ledger.spv.phase.SecondSignaturesPhase;
import com.flagship.spv_ledger.spv.phase.SentTransactionsPhase;
import com.flagship.spv_ledger.spv.phase.VotesPhase;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rebuilds the wallet ledger from persisted block history.
 *
 * A pass runs eight phases in a fixed order. Balances are composed as received transfers,
 * plus block rewards and fees, minus everything sent; the later phases restore second keys,
 * delegate registrations, votes and multisignatures and rank the delegates.
 *
 * The pass only reads history and only writes to the {@link WalletManager}. It expects a
 * store holding nothing but the seeded genesis and snapshot wallets; rebuilding twice into
 * the same store without {@link WalletManager#reset()} double-counts rewards.
 *
 * Any storage or decode failure aborts the pass with a {@link RebuildException}. Nothing is
 * retried and the store is left as it was when the failure hit.
 */
@Service
@Slf4j
public class SpvRebuildService {

    static final String PROGRESS_LABEL = "SPV Building";
    private static final String MDC_HEIGHT = "rebuildHeight";

    private final List<RebuildPhase> phases;
    private final WalletManager walletManager;
    private final NetworkConstants networkConstants;
    private final ProgressTracker progressTracker;
    private final RebuildDiagnostics diagnostics;
    private final RebuildMetrics rebuildMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<RebuildResult> lastResult = new AtomicReference<>();

    public SpvRebuildService(ReceivedTransfersPhase receivedTransfers,
                             BlockRewardsPhase blockRewards,
                             LastForgedBlocksPhase lastForgedBlocks,
                             SentTransactionsPhase sentTransactions,
                             SecondSignaturesPhase secondSignatures,
                             DelegatesPhase delegates,
                             VotesPhase votes,
                             MultiSignaturesPhase multiSignatures,
                             WalletManager walletManager,
                             NetworkConstants networkConstants,
                             ProgressTracker progressTracker,
                             RebuildDiagnostics diagnostics,
                             RebuildMetrics rebuildMetrics) {
        // Sent must follow received and rewards; votes must follow delegates.
        this.phases = List.of(
            receivedTransfers,
            blockRewards,
            lastForgedBlocks,
            sentTransactions,
            secondSignatures,
            delegates,
            votes,
            multiSignatures
        );
        this.walletManager = walletManager;
        this.networkConstants = networkConstants;
        this.progressTracker = progressTracker;
        this.diagnostics = diagnostics;
        this.rebuildMetrics = rebuildMetrics;
    }

    /**
     * Runs a full rebuild pass for the chain at {@code height}.
     *
     * @param height height of the last persisted block; selects the active delegate count
     * @return the completed result
     * @throws RebuildException if any phase fails
     * @throws IllegalStateException if another pass is already running
     */
    public RebuildResult build(long height) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A ledger rebuild is already running");
        }
        MDC.put(MDC_HEIGHT, String.valueOf(height));
        try {
            return runPhases(height);
        } finally {
            MDC.remove(MDC_HEIGHT);
            running.set(false);
        }
    }

    public Optional<RebuildResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    List<RebuildPhase> getPhases() {
        return phases;
    }

    private RebuildResult runPhases(long height) {
        int activeDelegates = networkConstants.getActiveDelegates(height);
        RebuildContext context = new RebuildContext(height, activeDelegates);
        RebuildResult started = RebuildResult.running(height, activeDelegates, Instant.now());
        lastResult.set(started);
        diagnostics.clear();

        log.info("Starting ledger rebuild: height={}, activeDelegates={}", height, activeDelegates);

        int total = phases.size();
        progressTracker.start(PROGRESS_LABEL, total);

        int step = 0;
        for (RebuildPhase phase : phases) {
            step++;
            progressTracker.advance(PROGRESS_LABEL, step, total, phase.getName());
            Instant phaseStart = Instant.now();
            try {
                phase.apply(context);
            } catch (DataAccessException | TransactionDecodeException e) {
                progressTracker.stop(PROGRESS_LABEL, step, total);
                RebuildException exception = new RebuildException(phase.getName(), height, e);
                recordFailure(started, phase.getName(), exception.getMessage());
                throw exception;
            } catch (RuntimeException e) {
                progressTracker.stop(PROGRESS_LABEL, step, total);
                recordFailure(started, phase.getName(), e.getMessage());
                throw e;
            }
            rebuildMetrics.recordPhase(phase.getName(), Duration.between(phaseStart, Instant.now()));
        }

        progressTracker.stop(PROGRESS_LABEL, total, total);

        RebuildResult completed = started.toBuilder()
            .status(RebuildStatus.COMPLETED)
            .finishedAt(Instant.now())
            .wallets(walletManager.countWallets())
            .delegates(walletManager.countDelegates())
            .coldWallets(diagnostics.count(AnomalyType.COLD_WALLET))
            .negativeBalances(diagnostics.count(AnomalyType.NEGATIVE_BALANCE))
            .build();
        lastResult.set(completed);
        rebuildMetrics.recordCompleted(completed.getDuration());

        log.info("SPV rebuild finished, wallets in memory: {}", completed.getWallets());
        log.info("Number of registered delegates: {}", completed.getDelegates());
        return completed;
    }

    private void recordFailure(RebuildResult started, String phaseName, String message) {
        lastResult.set(started.toBuilder()
            .status(RebuildStatus.FAILED)
            .finishedAt(Instant.now())
            .wallets(walletManager.countWallets())
            .delegates(walletManager.countDelegates())
            .coldWallets(diagnostics.count(AnomalyType.COLD_WALLET))
            .negativeBalances(diagnostics.count(AnomalyType.NEGATIVE_BALANCE))
            .failedPhase(phaseName)
            .failureMessage(message)
            .build());
        rebuildMetrics.recordFailed(phaseName);
        log.error("Ledger rebuild failed: phase={}, height={}, error={}", phaseName, started.getHeight(), message);
    }
}
