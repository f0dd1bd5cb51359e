package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.error.ConfigurationException;

public record ProviderProfile(
        String name,
        ProviderType type,
        String apiKey,
        String baseUrl,
        Boolean structuredOutput
) {

    public ProviderProfile {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Provider profile name is required");
        }
        if (type == null) {
            throw new ConfigurationException("Provider profile '" + name + "' has no type");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("Provider profile '" + name + "' has no API key");
        }
        baseUrl = baseUrl == null || baseUrl.isBlank() ? type.defaultBaseUrl() : baseUrl.trim();
        structuredOutput = structuredOutput == null ? Boolean.TRUE : structuredOutput;
    }

    @Override
    public String toString() {
        return "ProviderProfile{name=" + name + ", type=" + type.value() + ", baseUrl=" + baseUrl + "}";
    }
}
