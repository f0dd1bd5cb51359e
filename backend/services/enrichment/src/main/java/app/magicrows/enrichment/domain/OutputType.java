package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputType {
    TEXT("text"), CATEGORY("category"), NUMBER("number"), JSON("json");

    private final String value;

    OutputType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OutputType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("OutputType is required");
        }
        String trimmed = raw.trim();
        for (OutputType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unsupported OutputType: " + raw);
    }
}
