package app.magicrows.enrichment.service;

import java.util.List;

public record BatchRunResult(
        List<RowOutcome> outcomes,
        UsageAccumulator totals,
        int batches
) {

    public List<RowRecord> records() {
        return outcomes.stream().map(RowOutcome::record).toList();
    }
}
