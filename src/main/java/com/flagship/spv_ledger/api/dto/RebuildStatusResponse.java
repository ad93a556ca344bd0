package com.flagship.spv_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.spv_ledger.spv.RebuildResult;
import com.flagship.spv_ledger.spv.RebuildStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class RebuildStatusResponse {

    @JsonProperty("status")
    RebuildStatus status;

    @JsonProperty("height")
    long height;

    @JsonProperty("active_delegates")
    int activeDelegates;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("duration_ms")
    Long durationMs;

    @JsonProperty("wallets")
    int wallets;

    @JsonProperty("delegates")
    int delegates;

    @JsonProperty("cold_wallets")
    int coldWallets;

    @JsonProperty("negative_balances")
    int negativeBalances;

    @JsonProperty("failed_phase")
    String failedPhase;

    @JsonProperty("failure_message")
    String failureMessage;

    public static RebuildStatusResponse from(RebuildResult result) {
        Duration duration = result.getDuration();
        return RebuildStatusResponse.builder()
            .status(result.getStatus())
            .height(result.getHeight())
            .activeDelegates(result.getActiveDelegates())
            .startedAt(result.getStartedAt())
            .finishedAt(result.getFinishedAt())
            .durationMs(duration != null ? duration.toMillis() : null)
            .wallets(result.getWallets())
            .delegates(result.getDelegates())
            .coldWallets(result.getColdWallets())
            .negativeBalances(result.getNegativeBalances())
            .failedPhase(result.getFailedPhase())
            .failureMessage(result.getFailureMessage())
            .build();
    }
}
