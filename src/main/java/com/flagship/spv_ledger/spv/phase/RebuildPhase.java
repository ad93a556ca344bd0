package com.flagship.spv_ledger.spv.phase;

import com.flagship.spv_ledger.spv.RebuildContext;

/**
 * One aggregation-then-mutate pass of the ledger rebuild.
 *
 * Phases run in a fixed order and depend on the side effects of the phases before them.
 * Query and decode failures propagate unchanged.
 */
public interface RebuildPhase {

    /**
     * Human-readable name used in progress output and errors.
     */
    String getName();

    void apply(RebuildContext context);
}
