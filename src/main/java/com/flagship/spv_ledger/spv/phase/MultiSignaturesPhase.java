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
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Restores multisignature configuration. Newest registration wins; older ones are ignored.
 */
@Component
@RequiredArgsConstructor
public class MultiSignaturesPhase implements RebuildPhase {

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
        return "MultiSignatures";
    }

    @Override
    public void apply(RebuildContext context) {
        for (AggregatedRow row : historyQuery.query()
                .select("sender_public_key", "serialized")
                .from("transactions")
                .where("type", TransactionType.MULTI_SIGNATURE.getCode())
                .orderBy(NEWEST_FIRST)
                .all()) {
            Wallet wallet = walletManager.getWalletByPublicKey(row.getString("sender_public_key"));
            if (wallet.getMultisignature() == null) {
                wallet.setMultisignature(transactionCodec.deserialize(row.getHex("serialized")).getMultiSignature());
            }
        }
    }
}
