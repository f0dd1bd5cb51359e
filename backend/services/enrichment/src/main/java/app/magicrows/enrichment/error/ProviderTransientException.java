package app.magicrows.enrichment.error;

public class ProviderTransientException extends EnrichmentException {

    private final Integer statusCode;

    public ProviderTransientException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public EnrichmentError.Kind kind() {
        return EnrichmentError.Kind.PROVIDER_TRANSIENT;
    }
}
