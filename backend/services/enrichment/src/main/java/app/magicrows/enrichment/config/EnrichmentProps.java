package app.magicrows.enrichment.config;

import app.magicrows.enrichment.provider.ProviderProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.List;

@ConfigurationProperties(prefix = "app.enrichment")
public record EnrichmentProps(
        Integer batchSize,
        Integer maxAttempts,
        Long retryInitialDelayMs,
        Long retryMaxDelayMs,
        BigDecimal inputCostPerMillion,
        BigDecimal outputCostPerMillion,
        String claudeApiVersion,
        Integer claudeMaxTokens,
        Long connectTimeoutMs,
        Long readTimeoutMs,
        List<ProviderProfile> providers
) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_INITIAL_DELAY_MS = 2_000L;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 10_000L;
    public static final BigDecimal DEFAULT_INPUT_COST_PER_MILLION = new BigDecimal("0.15");
    public static final BigDecimal DEFAULT_OUTPUT_COST_PER_MILLION = new BigDecimal("0.60");
    public static final String DEFAULT_CLAUDE_API_VERSION = "2023-06-01";
    public static final int DEFAULT_CLAUDE_MAX_TOKENS = 1024;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_READ_TIMEOUT_MS = 60_000L;

    public static EnrichmentProps defaults() {
        return new EnrichmentProps(null, null, null, null, null, null, null, null, null, null, null).normalized();
    }

    public EnrichmentProps normalized() {
        return new EnrichmentProps(
                positive(batchSize, DEFAULT_BATCH_SIZE),
                positive(maxAttempts, DEFAULT_MAX_ATTEMPTS),
                positive(retryInitialDelayMs, DEFAULT_RETRY_INITIAL_DELAY_MS),
                positive(retryMaxDelayMs, DEFAULT_RETRY_MAX_DELAY_MS),
                inputCostPerMillion == null || inputCostPerMillion.signum() < 0
                        ? DEFAULT_INPUT_COST_PER_MILLION : inputCostPerMillion,
                outputCostPerMillion == null || outputCostPerMillion.signum() < 0
                        ? DEFAULT_OUTPUT_COST_PER_MILLION : outputCostPerMillion,
                claudeApiVersion == null || claudeApiVersion.isBlank() ? DEFAULT_CLAUDE_API_VERSION : claudeApiVersion,
                positive(claudeMaxTokens, DEFAULT_CLAUDE_MAX_TOKENS),
                positive(connectTimeoutMs, DEFAULT_CONNECT_TIMEOUT_MS),
                positive(readTimeoutMs, DEFAULT_READ_TIMEOUT_MS),
                providers == null ? List.of() : List.copyOf(providers)
        );
    }

    public EnrichmentProps withBatchSize(int size) {
        return new EnrichmentProps(size, maxAttempts, retryInitialDelayMs, retryMaxDelayMs,
                inputCostPerMillion, outputCostPerMillion, claudeApiVersion, claudeMaxTokens,
                connectTimeoutMs, readTimeoutMs, providers).normalized();
    }

    public EnrichmentProps withRetryDelays(long initialDelayMs, long maxDelayMs) {
        return new EnrichmentProps(batchSize, maxAttempts, initialDelayMs, maxDelayMs,
                inputCostPerMillion, outputCostPerMillion, claudeApiVersion, claudeMaxTokens,
                connectTimeoutMs, readTimeoutMs, providers).normalized();
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
