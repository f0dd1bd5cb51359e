package app.magicrows.enrichment.contract;

import app.magicrows.enrichment.domain.OutputCategory;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.error.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class ContractGenerator {

    private final ObjectMapper objectMapper;

    public ContractGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OutputContract generate(OutputSpecification output, boolean reasoningOverride) {
        ObjectNode valueShape = buildValueShape(output);
        boolean withReasoning = output.reasoningRequested(reasoningOverride);
        ObjectNode propertyShape = withReasoning ? wrapWithReasoning(output, valueShape) : valueShape;

        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.set(output.name(), propertyShape);
        schema.putArray("required").add(output.name());
        schema.put("additionalProperties", false);
        return new OutputContract(output.name(), schema, withReasoning);
    }

    private ObjectNode buildValueShape(OutputSpecification output) {
        ObjectNode base = objectMapper.createObjectNode();
        switch (output.type()) {
            case TEXT -> {
                base.put("type", "string");
                base.put("description", "Text output for " + output.name());
            }
            case NUMBER -> {
                base.put("type", "number");
                base.put("description", "Numeric output for " + output.name());
            }
            case CATEGORY -> {
                if (output.categories().isEmpty()) {
                    throw new ConfigurationException(
                            "Output '" + output.name() + "' is type 'category' but has no outputCategories defined");
                }
                base.put("type", "string");
                base.put("description", describeCategories(output));
                ArrayNode values = base.putArray("enum");
                for (OutputCategory category : output.categories()) {
                    if (category == null || category.name() == null || category.name().isBlank()) {
                        throw new ConfigurationException("Output '" + output.name() + "' has a category without a name");
                    }
                    values.add(category.name());
                }
            }
            case JSON -> {
                base.put("type", "string");
                base.put("description", "JSON string output for " + output.name() + ". The content must be valid JSON.");
            }
            default -> throw new ConfigurationException("Unsupported outputType: " + output.type());
        }
        if (!output.multiple()) {
            return base;
        }
        ObjectNode array = objectMapper.createObjectNode();
        array.put("type", "array");
        array.put("description", "List of " + output.type().value() + " values for " + output.name());
        array.set("items", base);
        return array;
    }

    private ObjectNode wrapWithReasoning(OutputSpecification output, ObjectNode valueShape) {
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.put("type", "object");
        wrapper.put("description", "Generated output for " + output.name() + " including reasoning");
        ObjectNode properties = wrapper.putObject("properties");
        properties.set(OutputContract.VALUE_FIELD, valueShape);
        ObjectNode reasoning = properties.putObject(OutputContract.REASONING_FIELD);
        reasoning.put("type", "string");
        reasoning.put("description", "Explanation for why the value was chosen or generated");
        wrapper.putArray("required").add(OutputContract.VALUE_FIELD).add(OutputContract.REASONING_FIELD);
        wrapper.put("additionalProperties", false);
        return wrapper;
    }

    private String describeCategories(OutputSpecification output) {
        StringBuilder builder = new StringBuilder("Categorical output for ").append(output.name());
        for (OutputCategory category : output.categories()) {
            if (category == null || category.description() == null || category.description().isBlank()) {
                continue;
            }
            builder.append("\n- ").append(category.name()).append(": ").append(category.description().trim());
        }
        return builder.toString();
    }
}
