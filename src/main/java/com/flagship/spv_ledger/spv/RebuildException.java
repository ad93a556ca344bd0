package com.flagship.spv_ledger.spv;

import lombok.Getter;

/**
 * A rebuild pass aborted. The wallet ledger is in an undefined state and must be reset before
 * another pass.
 */
@Getter
public class RebuildException extends RuntimeException {

    private final String phase;
    private final long height;

    public RebuildException(String phase, long height, Throwable cause) {
        super(String.format("SPV rebuild failed in phase '%s' at height %d: %s", phase, height, cause.getMessage()), cause);
        this.phase = phase;
        this.height = height;
    }
}
