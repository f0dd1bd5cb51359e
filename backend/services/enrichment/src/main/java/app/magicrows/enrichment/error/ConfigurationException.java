package app.magicrows.enrichment.error;

public class ConfigurationException extends EnrichmentException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public EnrichmentError.Kind kind() {
        return EnrichmentError.Kind.CONFIGURATION;
    }
}
