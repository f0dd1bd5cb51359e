package app.magicrows.enrichment.service;

import app.magicrows.enrichment.provider.TokenUsage;

import java.time.Duration;

public record RowOutcome(
        int rowIndex,
        RowRecord record,
        TokenUsage usage,
        Duration providerTime,
        int successfulCalls,
        int failedOutputs
) {
}
