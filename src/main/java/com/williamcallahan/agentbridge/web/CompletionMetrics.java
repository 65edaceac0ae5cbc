package com.williamcallahan.agentbridge.web;

import io.micrometer.core.instrument.Metrics;

/**
 * Counts completions by response mode and outcome.
 */
final class CompletionMetrics {

    static final String COMPLETIONS_METRIC = "agentbridge.completions";

    static final String MODE_STREAM = "stream";
    static final String MODE_AGGREGATE = "aggregate";

    static final String OUTCOME_COMPLETED = "completed";
    static final String OUTCOME_DISCONNECTED = "disconnected";
    static final String OUTCOME_FAILED = "failed";

    private CompletionMetrics() {}

    static void record(String mode, String outcome) {
        Metrics.counter(COMPLETIONS_METRIC, "mode", mode, "outcome", outcome).increment();
    }
}
