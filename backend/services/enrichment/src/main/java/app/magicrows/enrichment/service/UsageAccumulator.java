package app.magicrows.enrichment.service;

import app.magicrows.enrichment.provider.TokenUsage;

import java.time.Duration;

public class UsageAccumulator {

    private int rows;
    private int successfulCalls;
    private int failedOutputs;
    private TokenUsage usage = TokenUsage.ZERO;
    private Duration providerTime = Duration.ZERO;

    public void add(RowOutcome outcome) {
        rows++;
        successfulCalls += outcome.successfulCalls();
        failedOutputs += outcome.failedOutputs();
        usage = usage.plus(outcome.usage());
        if (outcome.providerTime() != null) {
            providerTime = providerTime.plus(outcome.providerTime());
        }
    }

    public int rows() {
        return rows;
    }

    public int successfulCalls() {
        return successfulCalls;
    }

    public int failedOutputs() {
        return failedOutputs;
    }

    public TokenUsage usage() {
        return usage;
    }

    public Duration providerTime() {
        return providerTime;
    }
}
