package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.ledger.Wallet;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Adds block rewards and collected fees to each generator's balance.
 */
@Component
@RequiredArgsConstructor
public class BlockRewardsPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;

    @Override
    public String getName() {
        return "Block Rewards";
    }

    @Override
    public void apply(RebuildContext context) {
        List<AggregatedRow> rows = historyQuery.query()
            .select("generator_public_key")
            .sum(List.of("reward", "total_fee"), "reward")
            .from("blocks")
            .groupBy("generator_public_key")
            .all();

        for (AggregatedRow row : rows) {
            Wallet wallet = walletManager.getWalletByPublicKey(row.getString("generator_public_key"));
            wallet.setBalance(wallet.getBalance() + row.getLong("reward"));
        }
    }
}
