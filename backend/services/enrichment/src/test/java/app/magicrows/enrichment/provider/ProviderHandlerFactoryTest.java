package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.config.EnrichmentProps;
import app.magicrows.enrichment.provider.claude.ClaudeProviderHandler;
import app.magicrows.enrichment.provider.gemini.GeminiProviderHandler;
import app.magicrows.enrichment.provider.openai.OpenAiProviderHandler;
import app.magicrows.enrichment.provider.perplexity.PerplexityProviderHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHandlerFactoryTest {

    private final ProviderHandlerFactory factory =
            new ProviderHandlerFactory(RestClient.builder(), new ObjectMapper(), EnrichmentProps.defaults());

    @Test
    void createsHandlerMatchingProfileType() {
        assertThat(factory.create(profile("a", ProviderType.OPENAI), false))
                .isExactlyInstanceOf(OpenAiProviderHandler.class);
        assertThat(factory.create(profile("b", ProviderType.PERPLEXITY), false))
                .isExactlyInstanceOf(PerplexityProviderHandler.class);
        assertThat(factory.create(profile("c", ProviderType.CLAUDE), false))
                .isExactlyInstanceOf(ClaudeProviderHandler.class);
        assertThat(factory.create(profile("d", ProviderType.GEMINI), false))
                .isExactlyInstanceOf(GeminiProviderHandler.class);
    }

    @Test
    void handlerReportsItsType() {
        assertThat(factory.create(profile("c", ProviderType.CLAUDE), true).type()).isEqualTo(ProviderType.CLAUDE);
    }

    private static ProviderProfile profile(String name, ProviderType type) {
        return new ProviderProfile(name, type, "key", null, null);
    }
}
