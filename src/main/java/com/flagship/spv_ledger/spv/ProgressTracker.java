package com.flagship.spv_ledger.spv;

/**
 * Fire-and-forget progress sink for multi-step work.
 */
public interface ProgressTracker {

    void start(String label, int total);

    void advance(String label, int step, int total, String stepName);

    void stop(String label, int step, int total);
}
