package app.magicrows.enrichment.provider.openai;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.provider.AbstractProviderHandler;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class OpenAiProviderHandler extends AbstractProviderHandler {

    private final OpenAiClient client;

    public OpenAiProviderHandler(ProviderProfile profile,
                                 OpenAiClient client,
                                 ObjectMapper objectMapper,
                                 boolean logPayloads) {
        super(profile, objectMapper, logPayloads);
        this.client = client;
    }

    @Override
    protected RawResponse send(String model, String prompt, double temperature, OutputContract contract) {
        ObjectNode responseFormat = contract == null ? null : buildResponseFormat(contract);
        return client.createChatCompletion(profile.apiKey(), new OpenAiChatRequest(model, prompt, temperature, responseFormat));
    }

    protected ObjectNode buildResponseFormat(OutputContract contract) {
        ObjectNode responseFormat = objectMapper.createObjectNode();
        responseFormat.put("type", "json_schema");
        ObjectNode jsonSchema = responseFormat.putObject("json_schema");
        jsonSchema.put("name", schemaName(contract));
        jsonSchema.set("schema", contract.schema().deepCopy());
        jsonSchema.put("strict", true);
        return responseFormat;
    }
}
