package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.history.SortDirection;
import com.flagship.spv_ledger.ledger.LastBlock;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Records a last forged block on the generators of the newest N blocks, N being the number
 * of active delegates.
 *
 * Rows are read newest first and every row overwrites, so a generator appearing more than once
 * among the N keeps the oldest of its blocks.
 */
@Component
@RequiredArgsConstructor
public class LastForgedBlocksPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;

    @Override
    public String getName() {
        return "Last Forged Blocks";
    }

    @Override
    public void apply(RebuildContext context) {
        for (AggregatedRow row : historyQuery.query()
                .select("id", "generator_public_key", "block_timestamp")
                .from("blocks")
                .orderBy("block_timestamp", SortDirection.DESC)
                .limit(context.getActiveDelegates())
                .all()) {
            String generator = row.getString("generator_public_key");
            walletManager.getWalletByPublicKey(generator).setLastBlock(
                new LastBlock(row.getString("id"), generator, row.getLong("block_timestamp")));
        }
    }
}
