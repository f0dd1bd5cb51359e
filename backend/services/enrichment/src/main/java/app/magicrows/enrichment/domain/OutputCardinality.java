package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputCardinality {
    SINGLE("single"), MULTIPLE("multiple");

    private final String value;

    OutputCardinality(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OutputCardinality fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("OutputCardinality is required");
        }
        String trimmed = raw.trim();
        for (OutputCardinality candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unsupported OutputCardinality: " + raw);
    }
}
