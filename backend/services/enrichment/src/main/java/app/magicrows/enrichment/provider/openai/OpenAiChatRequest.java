package app.magicrows.enrichment.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;

public record OpenAiChatRequest(
        String model,
        String prompt,
        Double temperature,
        JsonNode responseFormat
) {
}
