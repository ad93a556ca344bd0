package com.flagship.spv_ledger.spv;

import lombok.Value;

/**
 * Per-pass parameters resolved once by the orchestrator and shared by every phase.
 */
@Value
public class RebuildContext {
    long height;
    int activeDelegates;
}
