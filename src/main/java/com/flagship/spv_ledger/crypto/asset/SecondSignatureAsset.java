package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

/**
 * Registers a second public key whose signature is required on later transactions.
 */
@Value
public class SecondSignatureAsset implements TransactionAsset {
    String publicKey;

    @Override
    public TransactionType getType() {
        return TransactionType.SECOND_SIGNATURE;
    }
}
