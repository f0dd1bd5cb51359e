package app.magicrows.enrichment.provider.claude;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record ClaudeMessageRequest(
        String model,
        String prompt,
        Double temperature,
        Integer maxOutputTokens,
        ObjectNode tool
) {
}
