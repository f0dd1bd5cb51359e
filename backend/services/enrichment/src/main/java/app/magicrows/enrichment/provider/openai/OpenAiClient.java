package app.magicrows.enrichment.provider.openai;

import app.magicrows.enrichment.error.ProviderResponseException;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

public class OpenAiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String providerLabel;

    public OpenAiClient(RestClient.Builder restClientBuilder,
                        String baseUrl,
                        ObjectMapper objectMapper,
                        String providerLabel) {
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .build();
        this.objectMapper = objectMapper;
        this.providerLabel = providerLabel;
    }

    public RawResponse createChatCompletion(String apiKey, OpenAiChatRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", request.prompt());
        if (request.responseFormat() != null && !request.responseFormat().isNull()) {
            payload.set("response_format", request.responseFormat());
        }

        JsonNode response = restClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new ProviderResponseException(providerLabel + " response is empty", null);
        }

        String outputText = OpenAiResponseParser.extractText(response);
        String refusal = OpenAiResponseParser.extractRefusal(response);
        if (outputText.isBlank() && refusal != null) {
            throw new ProviderResponseException(providerLabel + " refused the request: " + refusal, refusal);
        }
        String finishReason = OpenAiResponseParser.extractFinishReason(response);
        JsonNode usage = response.path("usage");
        Integer promptTokens = usage.hasNonNull("prompt_tokens") ? usage.get("prompt_tokens").asInt() : null;
        Integer completionTokens = usage.hasNonNull("completion_tokens") ? usage.get("completion_tokens").asInt() : null;
        Integer totalTokens = usage.hasNonNull("total_tokens") ? usage.get("total_tokens").asInt() : null;
        return new RawResponse(
                outputText,
                request.responseFormat() != null,
                response.path("model").asText(request.model()),
                finishReason,
                "length".equals(finishReason),
                promptTokens,
                completionTokens,
                totalTokens,
                response
        );
    }

    private String bearer(String apiKey) {
        return "Bearer " + apiKey;
    }
}
