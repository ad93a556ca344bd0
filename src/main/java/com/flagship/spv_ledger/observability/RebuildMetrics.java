package com.flagship.spv_ledger.observability;

import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.AnomalyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for ledger rebuilds.
 *
 * Metrics exposed:
 * - spv.rebuild.completed: Counter of completed passes
 * - spv.rebuild.failed: Counter of aborted passes, tagged by phase
 * - spv.rebuild.duration: Timer for whole passes
 * - spv.rebuild.phase.duration: Timer per phase
 * - spv.rebuild.anomalies: Counter per anomaly type
 * - spv.ledger.wallets / spv.ledger.delegates: Gauges over the wallet store
 */
@Component
public class RebuildMetrics {

    private final MeterRegistry registry;

    private final Counter rebuildsCompleted;
    private final Timer rebuildTimer;

    public RebuildMetrics(MeterRegistry registry, WalletManager walletManager) {
        this.registry = registry;

        this.rebuildsCompleted = Counter.builder("spv.rebuild.completed")
                .description("Number of completed ledger rebuilds")
                .register(registry);

        this.rebuildTimer = Timer.builder("spv.rebuild.duration")
                .description("Time taken by a full ledger rebuild")
                .register(registry);

        registry.gauge("spv.ledger.wallets", Tags.empty(), walletManager, WalletManager::countWallets);
        registry.gauge("spv.ledger.delegates", Tags.empty(), walletManager, WalletManager::countDelegates);
    }

    public void recordCompleted(Duration duration) {
        rebuildsCompleted.increment();
        rebuildTimer.record(duration);
    }

    public void recordFailed(String phase) {
        registry.counter("spv.rebuild.failed", "phase", sanitizeTag(phase)).increment();
    }

    public void recordPhase(String phase, Duration duration) {
        registry.timer("spv.rebuild.phase.duration", "phase", sanitizeTag(phase)).record(duration);
    }

    public void recordAnomaly(AnomalyType type) {
        registry.counter("spv.rebuild.anomalies", "type", type.name().toLowerCase()).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        return value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
    }
}
