package com.flagship.spv_ledger.observability;

import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildResult;
import com.flagship.spv_ledger.spv.SpvRebuildService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicators for the rebuilt ledger.
 */
public class HealthIndicators {

    /**
     * UP once a rebuild completed, DOWN after a failed one. Before the first pass, and while
     * a pass is running, the status is UNKNOWN.
     */
    @Component("ledgerRebuildHealth")
    public static class LedgerRebuildHealthIndicator implements HealthIndicator {

        private final SpvRebuildService rebuildService;
        private final WalletManager walletManager;

        public LedgerRebuildHealthIndicator(SpvRebuildService rebuildService, WalletManager walletManager) {
            this.rebuildService = rebuildService;
            this.walletManager = walletManager;
        }

        @Override
        public Health health() {
            Optional<RebuildResult> last = rebuildService.getLastResult();
            if (last.isEmpty()) {
                return Health.unknown()
                        .withDetail("reason", "No rebuild has run yet")
                        .build();
            }

            RebuildResult result = last.get();
            Health.Builder builder = switch (result.getStatus()) {
                case COMPLETED -> Health.up();
                case FAILED -> Health.down()
                        .withDetail("failedPhase", String.valueOf(result.getFailedPhase()))
                        .withDetail("error", String.valueOf(result.getFailureMessage()));
                case RUNNING -> Health.unknown();
            };

            return builder
                    .withDetail("status", result.getStatus().name())
                    .withDetail("height", result.getHeight())
                    .withDetail("wallets", walletManager.countWallets())
                    .withDetail("delegates", walletManager.countDelegates())
                    .build();
        }
    }
}
