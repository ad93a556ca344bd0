package com.flagship.spv_ledger.history;

import com.flagship.spv_ledger.crypto.Transaction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A forged block as persisted in the {@code blocks} table, with its transactions in block order.
 */
@Value
@Builder
public class Block {
    String id;
    @Builder.Default
    int version = 0;
    long height;
    long timestamp;
    String previousBlock;
    String generatorPublicKey;
    long totalAmount;
    long totalFee;
    long reward;
    long payloadLength;
    @Singular
    List<Transaction> transactions;

    public int getNumberOfTransactions() {
        return transactions.size();
    }
}
