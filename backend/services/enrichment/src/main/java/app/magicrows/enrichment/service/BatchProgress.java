package app.magicrows.enrichment.service;

public record BatchProgress(
        int batchNumber,
        int totalBatches,
        int rowsDone,
        int totalRows
) {
}
