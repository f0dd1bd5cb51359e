package app.magicrows.enrichment.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

public final class OpenAiResponseParser {

    private OpenAiResponseParser() {
    }

    public static String extractText(JsonNode response) {
        JsonNode message = firstChoice(response).path("message");
        JsonNode content = message.get("content");
        if (content != null && content.isTextual()) {
            return content.asText();
        }
        if (content != null && content.isArray()) {
            StringBuilder builder = new StringBuilder();
            for (JsonNode part : content) {
                String text = part.path("text").asText(null);
                if (text != null && !text.isBlank()) {
                    if (!builder.isEmpty()) {
                        builder.append('\n');
                    }
                    builder.append(text);
                }
            }
            return builder.toString();
        }
        return "";
    }

    public static String extractRefusal(JsonNode response) {
        JsonNode refusal = firstChoice(response).path("message").get("refusal");
        return refusal != null && refusal.isTextual() ? refusal.asText() : null;
    }

    public static String extractFinishReason(JsonNode response) {
        return firstChoice(response).path("finish_reason").asText(null);
    }

    private static JsonNode firstChoice(JsonNode response) {
        if (response == null) {
            return MissingNode.getInstance();
        }
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return MissingNode.getInstance();
        }
        return choices.get(0);
    }
}
