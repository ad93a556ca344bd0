package com.flagship.spv_ledger.spv;

public enum RebuildStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
