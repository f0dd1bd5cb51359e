package app.magicrows.enrichment.provider;

public record ParsedOutput(
        Object value,
        String reasoning,
        boolean reasoningReturned,
        boolean extracted,
        String rawContent
) {

    public static ParsedOutput of(Object value, String rawContent) {
        return new ParsedOutput(value, null, false, true, rawContent);
    }

    public static ParsedOutput withReasoning(Object value, String reasoning, String rawContent) {
        return new ParsedOutput(value, reasoning, true, true, rawContent);
    }

    public static ParsedOutput missingReasoning(String rawContent) {
        return new ParsedOutput(null, null, false, true, rawContent);
    }

    public static ParsedOutput notExtracted(String rawContent) {
        return new ParsedOutput(rawContent, null, false, false, rawContent);
    }
}
