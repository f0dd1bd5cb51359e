package app.magicrows.enrichment.provider;

import com.fasterxml.jackson.databind.JsonNode;

public record RawResponse(
        String text,
        boolean structured,
        String model,
        String finishReason,
        boolean truncated,
        Integer promptTokens,
        Integer completionTokens,
        Integer totalTokens,
        JsonNode raw
) {
}
