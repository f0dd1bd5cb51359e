package app.magicrows.enrichment.error;

import java.util.Locale;

public record EnrichmentError(
        Kind kind,
        String message,
        String rawContent
) {

    public enum Kind {
        CONFIGURATION,
        TEMPLATE,
        PROVIDER_TRANSIENT,
        PROVIDER_REQUEST,
        PROVIDER_RESPONSE,
        EXTRACTION,
        INTERNAL
    }

    public static EnrichmentError from(EnrichmentException ex) {
        String raw = ex instanceof ProviderResponseException responseEx ? responseEx.getRawContent() : null;
        return new EnrichmentError(ex.kind(), ex.getMessage(), raw);
    }

    public static EnrichmentError extraction(String message, String rawContent) {
        return new EnrichmentError(Kind.EXTRACTION, message, rawContent);
    }

    @Override
    public String toString() {
        return "ERROR[" + kind.name().toLowerCase(Locale.ROOT) + "]: " + message;
    }
}
