package com.flagship.spv_ledger.spv;

/**
 * Historical data a rebuild tolerates but reports.
 */
public enum AnomalyType {
    /** Transfer recipient with no wallet in the ledger; its received total is dropped. */
    COLD_WALLET,
    /** Non-genesis wallet whose sends exceed what it received and earned. */
    NEGATIVE_BALANCE
}
