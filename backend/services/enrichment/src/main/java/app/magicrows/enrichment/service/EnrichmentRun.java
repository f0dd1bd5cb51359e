package app.magicrows.enrichment.service;

import app.magicrows.enrichment.table.DataTable;

public record EnrichmentRun(
        DataTable table,
        RunSummary summary
) {
}
