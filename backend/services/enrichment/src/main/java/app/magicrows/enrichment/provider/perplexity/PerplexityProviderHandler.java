package app.magicrows.enrichment.provider.perplexity;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.openai.OpenAiClient;
import app.magicrows.enrichment.provider.openai.OpenAiProviderHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class PerplexityProviderHandler extends OpenAiProviderHandler {

    public PerplexityProviderHandler(ProviderProfile profile,
                                     OpenAiClient client,
                                     ObjectMapper objectMapper,
                                     boolean logPayloads) {
        super(profile, client, objectMapper, logPayloads);
    }

    @Override
    protected ObjectNode buildResponseFormat(OutputContract contract) {
        ObjectNode responseFormat = objectMapper.createObjectNode();
        responseFormat.put("type", "json_schema");
        ObjectNode jsonSchema = responseFormat.putObject("json_schema");
        jsonSchema.put("name", schemaName(contract));
        jsonSchema.set("schema", contract.schema().deepCopy());
        return responseFormat;
    }
}
