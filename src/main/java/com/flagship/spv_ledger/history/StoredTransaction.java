package com.flagship.spv_ledger.history;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

import java.time.Instant;

/**
 * Row of the {@code transactions} table. The payload stays serialized until a phase decodes it.
 */
@Value
public class StoredTransaction {
    String id;
    String blockId;
    long blockHeight;
    int sequence;
    int version;
    TransactionType type;
    long timestamp;
    String senderPublicKey;
    String recipientId;
    long amount;
    long fee;
    String vendorFieldHex;
    byte[] serialized;
    Instant createdAt;
}
