package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.crypto.TransactionCodec;
import com.flagship.spv_ledger.crypto.TransactionType;
import com.flagship.spv_ledger.history.AggregatedRow;
import com.flagship.spv_ledger.history.HistoryQuery;
import com.flagship.spv_ledger.ledger.WalletManager;
import com.flagship.spv_ledger.spv.RebuildContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Restores registered second public keys.
 *
 * Rows are read in the store's natural order and every row overwrites the key, so with several
 * registrations per sender the last one read wins. No guard flag is involved.
 */
@Component
@RequiredArgsConstructor
public class SecondSignaturesPhase implements RebuildPhase {

    private final HistoryQuery historyQuery;
    private final WalletManager walletManager;
    private final TransactionCodec transactionCodec;

    @Override
    public String getName() {
        return "Second Signatures";
    }

    @Override
    public void apply(RebuildContext context) {
        for (AggregatedRow row : historyQuery.query()
                .select("sender_public_key", "serialized")
                .from("transactions")
                .where("type", TransactionType.SECOND_SIGNATURE.getCode())
                .all()) {
            String publicKey = transactionCodec.deserialize(row.getHex("serialized")).getSecondSignature().getPublicKey();
            walletManager.getWalletByPublicKey(row.getString("sender_public_key")).setSecondPublicKey(publicKey);
        }
    }
}
