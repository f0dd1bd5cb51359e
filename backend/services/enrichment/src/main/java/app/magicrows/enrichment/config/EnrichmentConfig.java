package app.magicrows.enrichment.config;

import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.provider.ProviderHandlerFactory;
import app.magicrows.enrichment.service.EnrichmentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class EnrichmentConfig {

    @Bean
    public RestClientCustomizer providerTimeoutsCustomizer(EnrichmentProps props) {
        EnrichmentProps normalized = props.normalized();
        return builder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(Duration.ofMillis(normalized.connectTimeoutMs()));
            requestFactory.setReadTimeout(Duration.ofMillis(normalized.readTimeoutMs()));
            builder.requestFactory(requestFactory);
        };
    }

    @Bean
    public ContractGenerator contractGenerator(ObjectMapper objectMapper) {
        return new ContractGenerator(objectMapper);
    }

    @Bean
    public ProviderHandlerFactory providerHandlerFactory(RestClient.Builder restClientBuilder,
                                                         ObjectMapper objectMapper,
                                                         EnrichmentProps props) {
        return new ProviderHandlerFactory(restClientBuilder, objectMapper, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.enrichment", name = "providers[0].name")
    public EnrichmentService enrichmentService(EnrichmentProps props,
                                               ProviderHandlerFactory providerHandlerFactory,
                                               ContractGenerator contractGenerator) {
        EnrichmentProps normalized = props.normalized();
        return new EnrichmentService(normalized.providers(), providerHandlerFactory, contractGenerator, normalized);
    }
}
