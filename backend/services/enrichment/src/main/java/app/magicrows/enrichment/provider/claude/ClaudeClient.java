package app.magicrows.enrichment.provider.claude;

import app.magicrows.enrichment.error.ProviderResponseException;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

public class ClaudeClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiVersion;

    public ClaudeClient(RestClient.Builder restClientBuilder,
                        String baseUrl,
                        String apiVersion,
                        ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.clone().baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.apiVersion = apiVersion;
    }

    public RawResponse createMessage(String apiKey, ClaudeMessageRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        if (request.maxOutputTokens() != null && request.maxOutputTokens() > 0) {
            payload.put("max_tokens", request.maxOutputTokens());
        }
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }

        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", request.prompt());

        String toolName = null;
        if (request.tool() != null) {
            toolName = request.tool().path("name").asText();
            payload.putArray("tools").add(request.tool());
            ObjectNode toolChoice = payload.putObject("tool_choice");
            toolChoice.put("type", "tool");
            toolChoice.put("name", toolName);
        }

        JsonNode response = restClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", apiVersion)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new ProviderResponseException("Claude response is empty", null);
        }

        String outputText = ClaudeResponseParser.extractText(response);
        if (toolName != null) {
            JsonNode toolInput = ClaudeResponseParser.extractToolInput(response, toolName);
            if (toolInput != null) {
                outputText = toolInput.toString();
            }
        }
        String stopReason = response.path("stop_reason").asText(null);
        JsonNode usage = response.path("usage");
        Integer inputTokens = usage.hasNonNull("input_tokens") ? usage.get("input_tokens").asInt() : null;
        Integer outputTokens = usage.hasNonNull("output_tokens") ? usage.get("output_tokens").asInt() : null;
        Integer totalTokens = inputTokens == null && outputTokens == null
                ? null
                : (inputTokens == null ? 0 : inputTokens) + (outputTokens == null ? 0 : outputTokens);
        return new RawResponse(
                outputText,
                request.tool() != null,
                response.path("model").asText(request.model()),
                stopReason,
                "max_tokens".equals(stopReason),
                inputTokens,
                outputTokens,
                totalTokens,
                response
        );
    }
}
