package com.flagship.spv_ledger.ledger;

import lombok.Value;

/**
 * Snapshot of the most recent block forged by a delegate.
 */
@Value
public class LastBlock {
    String id;
    String generatorPublicKey;
    long timestamp;
}
