package app.magicrows.enrichment.error;

public class ProviderRequestException extends EnrichmentException {

    private final Integer statusCode;

    public ProviderRequestException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public EnrichmentError.Kind kind() {
        return EnrichmentError.Kind.PROVIDER_REQUEST;
    }
}
