package app.magicrows.enrichment.error;

public class TemplateException extends EnrichmentException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public EnrichmentError.Kind kind() {
        return EnrichmentError.Kind.TEMPLATE;
    }
}
