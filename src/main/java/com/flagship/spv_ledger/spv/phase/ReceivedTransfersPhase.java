package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.crypto.TransactionType;
import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import com.flagship.spv_ledger.spv.RebuildDiagnostics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sets each known recipient's balance to the total of the transfers it received.
 *
 * The balance is overwritten, not added to. Recipients without a wallet are reported as cold
 * wallets and their totals dropped; this phase never creates wallets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReceivedTransfersPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;
    private final RebuildDiagnostics diagnostics;

    @Override
    public String getName() {
        return "Received Transactions";
    }

    @Override
    public void apply(RebuildContext context) {
        List<AggregatedRow> rows = historyQuery.query()
            .select("recipient_id")
            .sum("amount", "amount")
            .from("transactions")
            .where("type", TransactionType.TRANSFER.getCode())
            .groupBy("recipient_id")
            .all();

        for (AggregatedRow row : rows) {
            String recipientId = row.getString("recipient_id");
            long amount = row.getLong("amount");

            walletManager.findWalletByAddress(recipientId).ifPresentOrElse(
                wallet -> wallet.setBalance(amount),
                () -> diagnostics.coldWallet(recipientId, amount)
            );
        }
        log.debug("Applied received totals for {} recipients", rows.size());
    }
}
