package app.magicrows.enrichment.error;

public class ProviderResponseException extends EnrichmentException {

    private final String rawContent;

    public ProviderResponseException(String message, String rawContent) {
        super(message);
        this.rawContent = rawContent;
    }

    public ProviderResponseException(String message, String rawContent, Throwable cause) {
        super(message, cause);
        this.rawContent = rawContent;
    }

    public String getRawContent() {
        return rawContent;
    }

    @Override
    public EnrichmentError.Kind kind() {
        return EnrichmentError.Kind.PROVIDER_RESPONSE;
    }
}
