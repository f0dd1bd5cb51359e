package app.magicrows.enrichment.provider.gemini;

import com.fasterxml.jackson.databind.JsonNode;

public record GeminiGenerateRequest(
        String model,
        String prompt,
        Double temperature,
        String responseMimeType,
        JsonNode responseSchema
) {
}
