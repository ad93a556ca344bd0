package com.flagship.spv_ledger.spv;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of the latest rebuild pass. Only a {@link RebuildStatus#COMPLETED} result marks a
 * ledger that callers may adopt.
 */
@Value
@Builder(toBuilder = true)
public class RebuildResult {
    RebuildStatus status;
    long height;
    int activeDelegates;
    Instant startedAt;
    Instant finishedAt;
    int wallets;
    int delegates;
    int coldWallets;
    int negativeBalances;
    String failedPhase;
    String failureMessage;

    public static RebuildResult running(long height, int activeDelegates, Instant startedAt) {
        return RebuildResult.builder()
            .status(RebuildStatus.RUNNING)
            .height(height)
            .activeDelegates(activeDelegates)
            .startedAt(startedAt)
            .build();
    }

    public Duration getDuration() {
        return finishedAt == null ? null : Duration.between(startedAt, finishedAt);
    }

    public boolean isCompleted() {
        return status == RebuildStatus.COMPLETED;
    }
}
