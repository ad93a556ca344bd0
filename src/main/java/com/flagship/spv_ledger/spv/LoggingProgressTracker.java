package com.flagship.spv_ledger.spv;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes progress as INFO log lines, e.g. {@code SPV Building [3/8] Last Forged Blocks}.
 */
@Component
@Slf4j
public class LoggingProgressTracker implements ProgressTracker {

    @Override
    public void start(String label, int total) {
        log.info("{} started ({} steps)", label, total);
    }

    @Override
    public void advance(String label, int step, int total, String stepName) {
        log.info("{} [{}/{}] {}", label, step, total, stepName);
    }

    @Override
    public void stop(String label, int step, int total) {
        log.info("{} stopped at step {}/{}", label, step, total);
    }
}
