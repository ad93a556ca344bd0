package com.flagship.spv_ledger.spv.phase;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Restores delegate registrations in three steps.
 *
 * <ol>
 *   <li>Sets the username of every registrant from its registration payload.</li>
 *   <li>Loads the registrants' persisted vote balances, ordered vote balance descending then
 *       public key ascending, and assigns rate by position starting at 1.</li>
 *   <li>Loads forged fees, rewards and produced block counts per generator.</li>
 * </ol>
 *
 * Ranks assigned here are provisional; the votes phase ranks again from the rebuilt balances.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DelegatesPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;
    private final TransactionCodec transactionCodec;

    @Override
    public String getName() {
        return "Delegates";
    }

    @Override
    public void apply(RebuildContext context) {
        Set<String> registrants = registerUsernames();
        if (registrants.isEmpty()) {
            log.debug("No delegate registrations found");
            return;
        }
        rankRegistrants(registrants);
        applyForgedTotals(registrants);
    }

    private Set<String> registerUsernames() {
        Set<String> registrants = new LinkedHashSet<>();
        for (AggregatedRow row : historyQuery.query()
                .select("sender_public_key", "serialized")
                .from("transactions")
                .where("type", TransactionType.DELEGATE_REGISTRATION.getCode())
                .all()) {
            String publicKey = row.getString("sender_public_key");
            Wallet wallet = walletManager.getWalletByPublicKey(publicKey);
            wallet.setUsername(transactionCodec.deserialize(row.getHex("serialized")).getDelegate().getUsername());
            walletManager.reindex(wallet);
            registrants.add(publicKey);
        }
        return registrants;
    }

    private void rankRegistrants(Set<String> registrants) {
        LinkedHashMap<String, SortDirection> ordering = new LinkedHashMap<>();
        ordering.put("vote_balance", SortDirection.DESC);
        ordering.put("public_key", SortDirection.ASC);

        List<AggregatedRow> rows = historyQuery.query()
            .select("public_key", "vote_balance")
            .from("wallets")
            .whereIn("public_key", registrants)
            .orderBy(ordering)
            .all();

        for (int i = 0; i < rows.size(); i++) {
            AggregatedRow row = rows.get(i);
            Wallet delegate = walletManager.getWalletByPublicKey(row.getString("public_key"));
            delegate.setVoteBalance(row.getLong("vote_balance"));
            delegate.setRate(i + 1);
            walletManager.reindex(delegate);
        }
        if (rows.size() < registrants.size()) {
            log.debug("{} of {} registrants have no persisted wallet row", registrants.size() - rows.size(), registrants.size());
        }
    }

    private void applyForgedTotals(Set<String> registrants) {
        for (AggregatedRow row : historyQuery.query()
                .select("generator_public_key")
                .sum("total_fee", "total_fees")
                .sum("reward", "total_rewards")
                .count("total_amount", "total_produced")
                .from("blocks")
                .whereIn("generator_public_key", registrants)
                .groupBy("generator_public_key")
                .all()) {
            Wallet delegate = walletManager.getWalletByPublicKey(row.getString("generator_public_key"));
            delegate.setForgedFees(row.getLong("total_fees"));
            delegate.setForgedRewards(row.getLong("total_rewards"));
            delegate.setProducedBlocks(row.getLong("total_produced"));
            walletManager.reindex(delegate);
        }
    }
}
