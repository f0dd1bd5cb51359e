package app.magicrows.enrichment.provider.openai;

import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.domain.OutputCardinality;
import app.magicrows.enrichment.domain.OutputCategory;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.OutputType;
import app.magicrows.enrichment.error.ProviderRequestException;
import app.magicrows.enrichment.error.ProviderResponseException;
import app.magicrows.enrichment.error.ProviderTransientException;
import app.magicrows.enrichment.provider.ParsedOutput;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.ProviderType;
import app.magicrows.enrichment.provider.RawResponse;
import app.magicrows.enrichment.provider.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiProviderHandlerTest {

    private static final String BASE_URL = "https://openai.test/v1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ContractGenerator contractGenerator = new ContractGenerator(objectMapper);

    private final OutputSpecification sentiment = new OutputSpecification("sentiment", "Classify {{review}}",
            OutputType.CATEGORY, null,
            List.of(new OutputCategory("Positive", null), new OutputCategory("Negative", null)),
            null, true);

    private MockRestServiceServer server;
    private OpenAiProviderHandler handler;

    @BeforeEach
    void setUp() {
        handler = handlerFor(profile(true));
    }

    @Test
    void structuredRequestCarriesStrictSchemaAndParsesReasoning() {
        OutputContract contract = contractGenerator.generate(sentiment, true);
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.messages[0].content").value("Classify this"))
                .andExpect(jsonPath("$.response_format.type").value("json_schema"))
                .andExpect(jsonPath("$.response_format.json_schema.name").value("sentiment"))
                .andExpect(jsonPath("$.response_format.json_schema.strict").value(true))
                .andExpect(jsonPath("$.response_format.json_schema.schema.properties.sentiment.required[1]").value("reasoning"))
                .andRespond(withSuccess(completion(
                        "{\\\"sentiment\\\":{\\\"value\\\":\\\"Positive\\\",\\\"reasoning\\\":\\\"Praise\\\"}}", "stop"),
                        MediaType.APPLICATION_JSON));

        RawResponse response = handler.complete("gpt-4o-mini", "Classify this", 0.1, contract);
        ParsedOutput parsed = handler.parse(response, sentiment, contract);

        server.verify();
        assertThat(response.structured()).isTrue();
        assertThat(parsed.value()).isEqualTo("Positive");
        assertThat(parsed.reasoning()).isEqualTo("Praise");
        assertThat(parsed.reasoningReturned()).isTrue();
        assertThat(handler.usage(response)).contains(new TokenUsage(12, 7, 19));
    }

    @Test
    void rateLimitIsTransient() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("{\"error\":\"slow down\"}"));

        ProviderTransientException ex = assertThrows(ProviderTransientException.class,
                () -> handler.complete("gpt-4o-mini", "p", 0.1, null));

        assertThat(ex.getStatusCode()).isEqualTo(429);
        assertThat(ex.getMessage()).contains("slow down");
    }

    @Test
    void serverErrorIsTransient() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(ProviderTransientException.class, () -> handler.complete("gpt-4o-mini", "p", 0.1, null));
    }

    @Test
    void timeoutIsTransient() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withException(new SocketTimeoutException("read timed out")));

        ProviderTransientException ex = assertThrows(ProviderTransientException.class,
                () -> handler.complete("gpt-4o-mini", "p", 0.1, null));

        assertThat(ex.getStatusCode()).isNull();
    }

    @Test
    void badRequestIsNotRetryable() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"error\":\"bad schema\"}"));

        ProviderRequestException ex = assertThrows(ProviderRequestException.class,
                () -> handler.complete("gpt-4o-mini", "p", 0.1, null));

        assertThat(ex.getStatusCode()).isEqualTo(400);
    }

    @Test
    void refusalIsResponseError() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":null,\"refusal\":\"I can't\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThrows(ProviderResponseException.class, () -> handler.complete("gpt-4o-mini", "p", 0.1, null));
    }

    @Test
    void freeTextProfileOmitsResponseFormatAndMatchesCategory() {
        handler = handlerFor(profile(false));
        OutputSpecification plain = new OutputSpecification("sentiment", "Classify", OutputType.CATEGORY, null,
                List.of(new OutputCategory("Positive", null), new OutputCategory("Negative", null)), null, false);
        OutputContract contract = contractGenerator.generate(plain, true);
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(jsonPath("$.response_format").doesNotExist())
                .andRespond(withSuccess(completion("The tone is clearly Negative.", "stop"), MediaType.APPLICATION_JSON));

        RawResponse response = handler.complete("gpt-4o-mini", "Classify", 0.1, contract);
        ParsedOutput parsed = handler.parse(response, plain, contract);

        assertThat(response.structured()).isFalse();
        assertThat(parsed.extracted()).isTrue();
        assertThat(parsed.value()).isEqualTo("Negative");
    }

    @Test
    void freeTextWithoutCategoryIsNotExtracted() {
        OutputSpecification plain = new OutputSpecification("sentiment", "Classify", OutputType.CATEGORY, null,
                List.of(new OutputCategory("Positive", null)), null, false);
        OutputContract contract = contractGenerator.generate(plain, true);

        ParsedOutput parsed = handler.parse(raw("Hard to say.", false), plain, contract);

        assertThat(parsed.extracted()).isFalse();
        assertThat(parsed.value()).isEqualTo("Hard to say.");
    }

    @Test
    void singleValueForMultipleBecomesOneElementList() {
        OutputSpecification tags = new OutputSpecification("tags", "Tags", OutputType.TEXT,
                OutputCardinality.MULTIPLE, null, null, false);
        OutputContract contract = contractGenerator.generate(tags, true);

        ParsedOutput parsed = handler.parse(raw("{\"tags\":\"battery\"}", true), tags, contract);

        assertThat(parsed.value()).isEqualTo(List.of("battery"));
    }

    @Test
    void unexpectedReasoningShapeYieldsAbsentValueAndReasoning() {
        OutputContract contract = contractGenerator.generate(sentiment, true);

        ParsedOutput parsed = handler.parse(raw("{\"sentiment\":\"Positive\"}", true), sentiment, contract);

        assertThat(parsed.extracted()).isTrue();
        assertThat(parsed.value()).isNull();
        assertThat(parsed.reasoning()).isNull();
        assertThat(parsed.reasoningReturned()).isFalse();
    }

    @Test
    void contractViolationIsResponseError() {
        OutputContract contract = contractGenerator.generate(sentiment, false);
        OutputSpecification noReasoning = new OutputSpecification("sentiment", "Classify", OutputType.CATEGORY, null,
                sentiment.categories(), null, false);

        ProviderResponseException ex = assertThrows(ProviderResponseException.class,
                () -> handler.parse(raw("{\"sentiment\":\"Mixed\"}", true), noReasoning, contract));

        assertThat(ex.getRawContent()).isEqualTo("{\"sentiment\":\"Mixed\"}");
    }

    @Test
    void numberAndJsonValuesAreDecoded() {
        OutputSpecification score = new OutputSpecification("score", "Score", OutputType.NUMBER, null, null, null, false);
        OutputSpecification payload = new OutputSpecification("payload", "Extract", OutputType.JSON, null, null, null, false);

        ParsedOutput number = handler.parse(raw("{\"score\": 4.5}", true), score,
                contractGenerator.generate(score, true));
        ParsedOutput json = handler.parse(raw("{\"payload\": \"{\\\"city\\\": \\\"Oslo\\\"}\"}", true), payload,
                contractGenerator.generate(payload, true));

        assertThat(number.value()).isEqualTo(new BigDecimal("4.5"));
        assertThat(json.value()).isInstanceOf(JsonNode.class);
        assertThat(((JsonNode) json.value()).path("city").asText()).isEqualTo("Oslo");
    }

    @Test
    void invalidJsonValueIsResponseError() {
        OutputSpecification payload = new OutputSpecification("payload", "Extract", OutputType.JSON, null, null, null, false);

        assertThrows(ProviderResponseException.class, () -> handler.parse(raw("{\"payload\": \"not json {\"}", true),
                payload, contractGenerator.generate(payload, true)));
    }

    @Test
    void nonJsonStructuredTextFallsBackToFreeText() {
        OutputSpecification summary = new OutputSpecification("summary", "Summarize", OutputType.TEXT, null, null, null, false);

        ParsedOutput parsed = handler.parse(raw("**Great** battery", true), summary,
                contractGenerator.generate(summary, true));

        assertThat(parsed.value()).isEqualTo("Great battery");
    }

    @Test
    void emptyTextIsResponseError() {
        OutputSpecification summary = new OutputSpecification("summary", "Summarize", OutputType.TEXT, null, null, null, false);

        assertThrows(ProviderResponseException.class, () -> handler.parse(raw("  ", true), summary,
                contractGenerator.generate(summary, true)));
    }

    private OpenAiProviderHandler handlerFor(ProviderProfile profile) {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        OpenAiClient client = new OpenAiClient(builder, profile.baseUrl(), objectMapper, "OpenAI");
        return new OpenAiProviderHandler(profile, client, objectMapper, false);
    }

    private ProviderProfile profile(boolean structured) {
        return new ProviderProfile("openai-main", ProviderType.OPENAI, "sk-test", BASE_URL, structured);
    }

    private RawResponse raw(String text, boolean structured) {
        return new RawResponse(text, structured, "gpt-4o-mini", "stop", false, null, null, null, null);
    }

    private String completion(String escapedContent, String finishReason) {
        return "{\"model\":\"gpt-4o-mini\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\""
                + escapedContent + "\"},\"finish_reason\":\"" + finishReason + "\"}],"
                + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":7,\"total_tokens\":19}}";
    }
}
