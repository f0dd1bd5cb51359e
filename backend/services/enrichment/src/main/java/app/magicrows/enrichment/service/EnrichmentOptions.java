package app.magicrows.enrichment.service;

public record EnrichmentOptions(
        boolean logPayloads,
        boolean logSummary,
        boolean includeReasoning,
        BatchProgressListener progressListener
) {

    public static EnrichmentOptions defaults() {
        return new EnrichmentOptions(false, true, true, null);
    }

    public EnrichmentOptions withoutReasoning() {
        return new EnrichmentOptions(logPayloads, logSummary, false, progressListener);
    }

    public EnrichmentOptions withProgressListener(BatchProgressListener listener) {
        return new EnrichmentOptions(logPayloads, logSummary, includeReasoning, listener);
    }
}
