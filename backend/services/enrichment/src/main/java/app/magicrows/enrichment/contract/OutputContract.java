package app.magicrows.enrichment.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record OutputContract(
        String name,
        ObjectNode schema,
        boolean withReasoning
) {

    public static final String VALUE_FIELD = "value";
    public static final String REASONING_FIELD = "reasoning";

    public JsonNode propertySchema() {
        return schema.path("properties").path(name);
    }

    public JsonNode valueSchema() {
        JsonNode property = propertySchema();
        return withReasoning ? property.path("properties").path(VALUE_FIELD) : property;
    }

    public OutputContract unwrapped() {
        if (!withReasoning) {
            return this;
        }
        ObjectNode copy = schema.deepCopy();
        ObjectNode properties = (ObjectNode) copy.get("properties");
        properties.set(name, valueSchema().deepCopy());
        return new OutputContract(name, copy, false);
    }
}
