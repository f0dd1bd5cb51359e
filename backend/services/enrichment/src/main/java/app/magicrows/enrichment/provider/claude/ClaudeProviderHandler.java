package app.magicrows.enrichment.provider.claude;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.provider.AbstractProviderHandler;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class ClaudeProviderHandler extends AbstractProviderHandler {

    private final ClaudeClient client;
    private final int maxOutputTokens;

    public ClaudeProviderHandler(ProviderProfile profile,
                                 ClaudeClient client,
                                 ObjectMapper objectMapper,
                                 int maxOutputTokens,
                                 boolean logPayloads) {
        super(profile, objectMapper, logPayloads);
        this.client = client;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    protected RawResponse send(String model, String prompt, double temperature, OutputContract contract) {
        ObjectNode tool = contract == null ? null : buildTool(contract);
        return client.createMessage(profile.apiKey(),
                new ClaudeMessageRequest(model, prompt, temperature, maxOutputTokens, tool));
    }

    private ObjectNode buildTool(OutputContract contract) {
        ObjectNode tool = objectMapper.createObjectNode();
        tool.put("name", schemaName(contract));
        tool.put("description", "Record the generated value for " + contract.name());
        tool.set("input_schema", contract.schema().deepCopy());
        return tool;
    }
}
