package app.magicrows.enrichment.provider.perplexity;

import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.OutputType;
import app.magicrows.enrichment.provider.ParsedOutput;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.ProviderType;
import app.magicrows.enrichment.provider.RawResponse;
import app.magicrows.enrichment.provider.openai.OpenAiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PerplexityProviderHandlerTest {

    @Test
    void requestsNonStrictSchemaOnChatCompletions() {
        ObjectMapper objectMapper = new ObjectMapper();
        OutputSpecification population = new OutputSpecification("population", "Population of {{city}}",
                OutputType.NUMBER, null, null, null, false);
        OutputContract contract = new ContractGenerator(objectMapper).generate(population, true);

        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        ProviderProfile profile = new ProviderProfile("pplx", ProviderType.PERPLEXITY, "p-key", "https://pplx.test", null);
        PerplexityProviderHandler handler = new PerplexityProviderHandler(profile,
                new OpenAiClient(builder, profile.baseUrl(), objectMapper, "Perplexity"), objectMapper, false);

        server.expect(requestTo("https://pplx.test/chat/completions"))
                .andExpect(jsonPath("$.response_format.type").value("json_schema"))
                .andExpect(jsonPath("$.response_format.json_schema.schema.properties.population.type").value("number"))
                .andExpect(jsonPath("$.response_format.json_schema.strict").doesNotExist())
                .andRespond(withSuccess("""
                        {"model":"sonar","choices":[{"message":{"content":"```json\\n{\\"population\\": 709000}\\n```"},
                                                     "finish_reason":"stop"}]}
                        """, MediaType.APPLICATION_JSON));

        RawResponse response = handler.complete("sonar", "Population of Oslo", 0.1, contract);
        ParsedOutput parsed = handler.parse(response, population, contract);

        server.verify();
        assertThat(parsed.value()).isEqualTo(new BigDecimal("709000"));
        assertThat(handler.type()).isEqualTo(ProviderType.PERPLEXITY);
    }
}
