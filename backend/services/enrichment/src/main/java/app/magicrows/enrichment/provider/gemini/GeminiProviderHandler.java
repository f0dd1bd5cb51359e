package app.magicrows.enrichment.provider.gemini;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.provider.AbstractProviderHandler;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class GeminiProviderHandler extends AbstractProviderHandler {

    private static final String JSON_MIME_TYPE = "application/json";

    private final GeminiClient client;

    public GeminiProviderHandler(ProviderProfile profile,
                                 GeminiClient client,
                                 ObjectMapper objectMapper,
                                 boolean logPayloads) {
        super(profile, objectMapper, logPayloads);
        this.client = client;
    }

    @Override
    protected RawResponse send(String model, String prompt, double temperature, OutputContract contract) {
        if (contract == null) {
            return client.generateContent(profile.apiKey(),
                    new GeminiGenerateRequest(model, prompt, temperature, null, null));
        }
        return client.generateContent(profile.apiKey(),
                new GeminiGenerateRequest(model, prompt, temperature, JSON_MIME_TYPE, toGeminiSchema(contract.schema())));
    }

    static ObjectNode toGeminiSchema(ObjectNode schema) {
        ObjectNode copy = schema.deepCopy();
        stripAdditionalProperties(copy);
        return copy;
    }

    private static void stripAdditionalProperties(JsonNode node) {
        if (node.isObject()) {
            ((ObjectNode) node).remove("additionalProperties");
        }
        for (JsonNode child : node) {
            stripAdditionalProperties(child);
        }
    }
}
