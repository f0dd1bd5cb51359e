package app.magicrows.enrichment.provider.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

public final class GeminiResponseParser {

    private GeminiResponseParser() {
    }

    public static String extractText(JsonNode response) {
        List<String> answerParts = new ArrayList<>();
        for (JsonNode part : firstCandidate(response).path("content").path("parts")) {
            // thinking models return their reasoning trace as separate "thought" parts
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            String text = part.path("text").asText("");
            if (!text.isBlank()) {
                answerParts.add(text);
            }
        }
        return String.join("\n", answerParts);
    }

    public static String extractFinishReason(JsonNode response) {
        return textOrNull(firstCandidate(response).path("finishReason"));
    }

    public static String extractBlockReason(JsonNode response) {
        if (response == null) {
            return null;
        }
        return textOrNull(response.path("promptFeedback").path("blockReason"));
    }

    private static JsonNode firstCandidate(JsonNode response) {
        if (response == null) {
            return MissingNode.getInstance();
        }
        return response.path("candidates").path(0);
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
