package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

@Value
public class DelegateAsset implements TransactionAsset {
    String username;

    @Override
    public TransactionType getType() {
        return TransactionType.DELEGATE_REGISTRATION;
    }
}
