package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunMode {
    PREVIEW("preview"), FULL("full");

    private final String value;

    RunMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RunMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("RunMode is required");
        }
        String trimmed = raw.trim();
        for (RunMode candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed) || candidate.name().equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unsupported RunMode: " + raw);
    }
}
