package app.magicrows.enrichment.domain;

import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OutputSpecification(
        String name,
        String prompt,
        @JsonProperty("outputType") @JsonAlias("type") OutputType type,
        @JsonProperty("outputCardinality") @JsonAlias("cardinality") OutputCardinality cardinality,
        @JsonProperty("outputCategories") @JsonAlias("categories") List<OutputCategory> categories,
        List<String> contextColumns,
        Boolean includeReasoning
) {

    public static final String REASONING_SUFFIX = "_reasoning";

    public OutputSpecification {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Output name is required");
        }
        if (prompt == null) {
            throw new ConfigurationException("Output '" + name + "' has no prompt");
        }
        if (type == null) {
            throw new ConfigurationException("Output '" + name + "' has no outputType");
        }
        cardinality = cardinality == null ? OutputCardinality.SINGLE : cardinality;
        categories = categories == null ? List.of() : List.copyOf(categories);
        contextColumns = contextColumns == null ? List.of() : List.copyOf(contextColumns);
        includeReasoning = includeReasoning == null ? Boolean.TRUE : includeReasoning;
    }

    public boolean multiple() {
        return cardinality == OutputCardinality.MULTIPLE;
    }

    public boolean reasoningRequested(boolean runOverride) {
        return includeReasoning && runOverride;
    }

    public String reasoningField() {
        return name + REASONING_SUFFIX;
    }

    public List<String> categoryNames() {
        return categories.stream().map(OutputCategory::name).toList();
    }

    public List<String> resolveContextColumns(List<String> defaults) {
        if (!contextColumns.isEmpty()) {
            return contextColumns;
        }
        return defaults == null ? List.of() : defaults;
    }
}
