package app.magicrows.enrichment.service;

import app.magicrows.enrichment.provider.TokenUsage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

public record RunSummary(
        int rowsProcessed,
        int batches,
        int successfulCalls,
        int failedOutputs,
        Duration wallTime,
        Duration providerTime,
        TokenUsage usage,
        BigDecimal estimatedCost,
        BigDecimal budget,
        boolean budgetExceeded
) {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);

    public static RunSummary of(BatchRunResult result,
                                Duration wallTime,
                                BigDecimal inputCostPerMillion,
                                BigDecimal outputCostPerMillion,
                                BigDecimal budget) {
        UsageAccumulator totals = result.totals();
        BigDecimal cost = estimateCost(totals.usage(), inputCostPerMillion, outputCostPerMillion);
        return new RunSummary(
                totals.rows(),
                result.batches(),
                totals.successfulCalls(),
                totals.failedOutputs(),
                wallTime,
                totals.providerTime(),
                totals.usage(),
                cost,
                budget,
                budget != null && cost.compareTo(budget) > 0
        );
    }

    static BigDecimal estimateCost(TokenUsage usage, BigDecimal inputCostPerMillion, BigDecimal outputCostPerMillion) {
        BigDecimal input = BigDecimal.valueOf(usage.promptTokens()).multiply(inputCostPerMillion);
        BigDecimal output = BigDecimal.valueOf(usage.completionTokens()).multiply(outputCostPerMillion);
        return input.add(output).divide(ONE_MILLION, 6, RoundingMode.HALF_UP);
    }
}
