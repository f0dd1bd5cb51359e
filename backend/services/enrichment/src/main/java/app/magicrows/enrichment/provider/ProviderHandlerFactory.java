package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.config.EnrichmentProps;
import app.magicrows.enrichment.provider.claude.ClaudeClient;
import app.magicrows.enrichment.provider.claude.ClaudeProviderHandler;
import app.magicrows.enrichment.provider.gemini.GeminiClient;
import app.magicrows.enrichment.provider.gemini.GeminiProviderHandler;
import app.magicrows.enrichment.provider.openai.OpenAiClient;
import app.magicrows.enrichment.provider.openai.OpenAiProviderHandler;
import app.magicrows.enrichment.provider.perplexity.PerplexityProviderHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestClient;

public class ProviderHandlerFactory {

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final EnrichmentProps props;

    public ProviderHandlerFactory(RestClient.Builder restClientBuilder,
                                  ObjectMapper objectMapper,
                                  EnrichmentProps props) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.props = props.normalized();
    }

    public ProviderHandler create(ProviderProfile profile, boolean logPayloads) {
        return switch (profile.type()) {
            case OPENAI -> new OpenAiProviderHandler(profile,
                    new OpenAiClient(restClientBuilder, profile.baseUrl(), objectMapper, "OpenAI"),
                    objectMapper, logPayloads);
            case PERPLEXITY -> new PerplexityProviderHandler(profile,
                    new OpenAiClient(restClientBuilder, profile.baseUrl(), objectMapper, "Perplexity"),
                    objectMapper, logPayloads);
            case CLAUDE -> new ClaudeProviderHandler(profile,
                    new ClaudeClient(restClientBuilder, profile.baseUrl(), props.claudeApiVersion(), objectMapper),
                    objectMapper, props.claudeMaxTokens(), logPayloads);
            case GEMINI -> new GeminiProviderHandler(profile,
                    new GeminiClient(restClientBuilder, profile.baseUrl(), objectMapper),
                    objectMapper, logPayloads);
        };
    }
}
