package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;

/**
 * Type-specific part of a transaction. Exactly one implementation exists per {@link TransactionType}.
 */
public interface TransactionAsset {

    TransactionType getType();
}
