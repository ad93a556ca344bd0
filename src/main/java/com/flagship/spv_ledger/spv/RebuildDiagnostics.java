package com.flagship.spv_ledger.spv;

import com.flagship.spv_ledger.observability.RebuildMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects the non-fatal anomalies of the current rebuild pass.
 *
 * Every anomaly is logged at WARN and counted; the list is cleared when a pass starts.
 */
@Component
@Slf4j
public class RebuildDiagnostics {

    private final RebuildMetrics rebuildMetrics;
    private final List<Anomaly> anomalies = new CopyOnWriteArrayList<>();

    public RebuildDiagnostics(RebuildMetrics rebuildMetrics) {
        this.rebuildMetrics = rebuildMetrics;
    }

    public void coldWallet(String address, long amount) {
        log.warn("Lost cold wallet: {} {}", address, amount);
        record(new Anomaly(AnomalyType.COLD_WALLET, address, amount));
    }

    public void negativeBalance(String address, long balance) {
        log.warn("Negative balance: {} {}", address, balance);
        record(new Anomaly(AnomalyType.NEGATIVE_BALANCE, address, balance));
    }

    public List<Anomaly> getAnomalies() {
        return List.copyOf(anomalies);
    }

    public List<Anomaly> getAnomalies(AnomalyType type) {
        return anomalies.stream().filter(anomaly -> anomaly.getType() == type).toList();
    }

    public int count(AnomalyType type) {
        return getAnomalies(type).size();
    }

    void clear() {
        anomalies.clear();
    }

    private void record(Anomaly anomaly) {
        anomalies.add(anomaly);
        rebuildMetrics.recordAnomaly(anomaly.getType());
    }
}
