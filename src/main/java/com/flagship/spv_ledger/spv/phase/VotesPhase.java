package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.crypto.Transaction;
import com.flagship.spv_ledger.crypto.TransactionCodec;
import com.flagship.spv_ledger.crypto.TransactionType;
import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.history.SortDirection;
import com.flagship.spv_ledger.ledger.Wallet;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Restores each wallet's current vote, then ranks delegates from the rebuilt balances.
 *
 * Vote transactions are read newest first; the first one seen per sender is applied and the
 * {@code voted} flag makes every older one a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VotesPhase implements RebuildPhase {

    // insertion time, then block height, then position within the block
    private static final LinkedHashMap<String, SortDirection> NEWEST_FIRST = new LinkedHashMap<>();

    static {
        NEWEST_FIRST.put("created_at", SortDirection.DESC);
        NEWEST_FIRST.put("block_height", SortDirection.DESC);
        NEWEST_FIRST.put("sequence_number", SortDirection.DESC);
    }

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;
    private final TransactionCodec transactionCodec;

    @Override
    public String getName() {
        return "Votes";
    }

    @Override
    public void apply(RebuildContext context) {
        for (AggregatedRow row : historyQuery.query()
                .select("sender_public_key", "serialized")
                .from("transactions")
                .where("type", TransactionType.VOTE.getCode())
                .orderBy(NEWEST_FIRST)
                .all()) {
            Wallet wallet = walletManager.getWalletByPublicKey(row.getString("sender_public_key"));
            if (wallet.isVoted()) {
                continue;
            }
            Transaction transaction = transactionCodec.deserialize(row.getHex("serialized"));
            wallet.apply(transaction);
            wallet.setVoted(true);
        }

        List<Wallet> active = walletManager.recomputeDelegateRanking(context.getActiveDelegates());
        log.debug("{} active delegates after vote restore", active.size());
    }
}
