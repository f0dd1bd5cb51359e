package app.magicrows.enrichment.provider.claude;

import com.fasterxml.jackson.databind.JsonNode;

public final class ClaudeResponseParser {

    private ClaudeResponseParser() {
    }

    public static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        JsonNode content = response.path("content");
        if (!content.isArray() || content.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : content) {
            if (!"text".equals(block.path("type").asText())) {
                continue;
            }
            String text = block.path("text").asText(null);
            if (text != null && !text.isBlank()) {
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append(text);
            }
        }
        return sb.toString();
    }

    public static JsonNode extractToolInput(JsonNode response, String toolName) {
        if (response == null) {
            return null;
        }
        JsonNode content = response.path("content");
        if (!content.isArray()) {
            return null;
        }
        for (JsonNode block : content) {
            if ("tool_use".equals(block.path("type").asText())
                    && toolName.equals(block.path("name").asText())
                    && block.has("input")) {
                return block.get("input");
            }
        }
        return null;
    }
}
