package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.ledger.Wallet;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import com.flagship.spv_ledger.spv.RebuildDiagnostics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Subtracts everything each sender spent (amounts plus fees).
 *
 * Must run after the received and reward phases. A negative result is kept as is and reported
 * unless the wallet is a genesis wallet.
 */
@Component
@RequiredArgsConstructor
public class SentTransactionsPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;
    private final RebuildDiagnostics diagnostics;

    @Override
    public String getName() {
        return "Sent Transactions";
    }

    @Override
    public void apply(RebuildContext context) {
        for (AggregatedRow row : historyQuery.query()
                .select("sender_public_key")
                .sum("amount", "amount")
                .sum("fee", "fee")
                .from("transactions")
                .groupBy("sender_public_key")
                .all()) {
            Wallet wallet = walletManager.getWalletByPublicKey(row.getString("sender_public_key"));
            wallet.setBalance(wallet.getBalance() - (row.getLong("amount") + row.getLong("fee")));

            if (wallet.getBalance() < 0 && !walletManager.isGenesisWallet(wallet)) {
                diagnostics.negativeBalance(wallet.getAddress(), wallet.getBalance());
            }
        }
    }
}
