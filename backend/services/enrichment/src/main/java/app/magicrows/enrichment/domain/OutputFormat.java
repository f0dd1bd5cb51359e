package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputFormat {
    NEW_COLUMNS("newColumns"), NEW_ROWS("newRows");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OutputFormat fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("OutputFormat is required");
        }
        String trimmed = raw.trim();
        for (OutputFormat candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unsupported OutputFormat: " + raw);
    }
}
