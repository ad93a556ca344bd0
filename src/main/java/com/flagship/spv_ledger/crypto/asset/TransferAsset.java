package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

@Value
public class TransferAsset implements TransactionAsset {
    long amount;
    long expiration;
    String recipientId;

    @Override
    public TransactionType getType() {
        return TransactionType.TRANSFER;
    }
}
