package app.magicrows.enrichment.error;

public abstract class EnrichmentException extends RuntimeException {

    protected EnrichmentException(String message) {
        super(message);
    }

    protected EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract EnrichmentError.Kind kind();
}
