package app.magicrows.enrichment.provider;

public record TokenUsage(
        long promptTokens,
        long completionTokens,
        long totalTokens
) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    public static TokenUsage of(Integer promptTokens, Integer completionTokens, Integer totalTokens) {
        long prompt = promptTokens == null ? 0 : promptTokens;
        long completion = completionTokens == null ? 0 : completionTokens;
        long total = totalTokens == null ? prompt + completion : totalTokens;
        return new TokenUsage(prompt, completion, total);
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(
                promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens
        );
    }
}
