package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProviderType {
    OPENAI("openai", "https://api.openai.com/v1"),
    PERPLEXITY("perplexity", "https://api.perplexity.ai"),
    CLAUDE("claude", "https://api.anthropic.com"),
    GEMINI("gemini", "https://generativelanguage.googleapis.com");

    private final String value;
    private final String defaultBaseUrl;

    ProviderType(String value, String defaultBaseUrl) {
        this.value = value;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    @JsonCreator
    public static ProviderType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Provider type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        if (normalized.equals("anthropic")) {
            return CLAUDE;
        }
        throw new ConfigurationException("Unsupported provider type: " + raw);
    }
}
