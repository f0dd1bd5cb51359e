package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record TaskConfiguration(
        @JsonProperty("integrationName") @JsonAlias("providerName") String providerName,
        String model,
        Double temperature,
        RunMode mode,
        Integer previewRowCount,
        OutputFormat outputFormat,
        List<String> contextColumns,
        List<OutputSpecification> outputs,
        BigDecimal budget
) {

    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_PREVIEW_ROWS = 5;

    public TaskConfiguration {
        if (providerName == null || providerName.isBlank()) {
            throw new ConfigurationException("integrationName is required");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("model is required");
        }
        temperature = temperature == null ? DEFAULT_TEMPERATURE : temperature;
        if (temperature < 0.0 || temperature > 1.0) {
            throw new ConfigurationException("temperature must be within [0, 1], got " + temperature);
        }
        mode = mode == null ? RunMode.PREVIEW : mode;
        previewRowCount = previewRowCount == null ? DEFAULT_PREVIEW_ROWS : previewRowCount;
        if (previewRowCount < 1) {
            throw new ConfigurationException("previewRowCount must be at least 1");
        }
        if (outputFormat == null) {
            throw new ConfigurationException("outputFormat is required");
        }
        contextColumns = contextColumns == null ? List.of() : List.copyOf(contextColumns);
        if (outputs == null || outputs.isEmpty()) {
            throw new ConfigurationException("At least one output is required");
        }
        outputs = List.copyOf(outputs);
        Set<String> names = new HashSet<>();
        for (OutputSpecification output : outputs) {
            if (!names.add(output.name())) {
                throw new ConfigurationException("Duplicate output name: " + output.name());
            }
        }
        if (budget != null && budget.signum() < 0) {
            throw new ConfigurationException("budget must not be negative");
        }
    }

    public int rowLimit(int totalRows) {
        if (mode == RunMode.FULL) {
            return totalRows;
        }
        return Math.min(previewRowCount, totalRows);
    }
}
