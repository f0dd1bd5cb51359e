package app.magicrows.enrichment.provider.gemini;

import app.magicrows.enrichment.error.ProviderResponseException;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

public class GeminiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public GeminiClient(RestClient.Builder restClientBuilder,
                        String baseUrl,
                        ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.clone().baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
    }

    public RawResponse generateContent(String apiKey, GeminiGenerateRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        ArrayNode parts = user.putArray("parts");
        parts.addObject().put("text", request.prompt());

        ObjectNode generationConfig = payload.putObject("generationConfig");
        if (request.temperature() != null) {
            generationConfig.put("temperature", request.temperature());
        }
        if (request.responseMimeType() != null && !request.responseMimeType().isBlank()) {
            generationConfig.put("responseMimeType", request.responseMimeType());
        }
        if (request.responseSchema() != null && !request.responseSchema().isNull()) {
            generationConfig.set("responseSchema", request.responseSchema());
        }

        JsonNode response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent", request.model())
                .header("x-goog-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new ProviderResponseException("Gemini response is empty", null);
        }

        String outputText = GeminiResponseParser.extractText(response);
        String blockReason = GeminiResponseParser.extractBlockReason(response);
        if (outputText.isBlank() && blockReason != null) {
            throw new ProviderResponseException("Gemini blocked the prompt: " + blockReason, response.toString());
        }
        String finishReason = GeminiResponseParser.extractFinishReason(response);
        String model = response.path("modelVersion").asText(null);
        if (model == null || model.isBlank()) {
            model = request.model();
        }
        JsonNode usage = response.path("usageMetadata");
        Integer inputTokens = usage.hasNonNull("promptTokenCount") ? usage.get("promptTokenCount").asInt() : null;
        Integer outputTokens = usage.hasNonNull("candidatesTokenCount") ? usage.get("candidatesTokenCount").asInt() : null;
        Integer totalTokens = usage.hasNonNull("totalTokenCount") ? usage.get("totalTokenCount").asInt() : null;
        return new RawResponse(
                outputText,
                request.responseSchema() != null,
                model,
                finishReason,
                "MAX_TOKENS".equals(finishReason),
                inputTokens,
                outputTokens,
                totalTokens,
                response
        );
    }
}
