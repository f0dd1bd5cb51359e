package app.magicrows.enrichment.service;

import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.domain.OutputCategory;
import app.magicrows.enrichment.domain.OutputFormat;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.OutputType;
import app.magicrows.enrichment.domain.TaskConfiguration;
import app.magicrows.enrichment.error.ConfigurationException;
import app.magicrows.enrichment.error.EnrichmentError;
import app.magicrows.enrichment.error.ProviderRequestException;
import app.magicrows.enrichment.error.ProviderTransientException;
import app.magicrows.enrichment.provider.ParsedOutput;
import app.magicrows.enrichment.provider.ProviderHandler;
import app.magicrows.enrichment.provider.RawResponse;
import app.magicrows.enrichment.provider.TokenUsage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RowProcessorTest {

    @Mock
    ProviderHandler handler;

    private final ContractGenerator contractGenerator = new ContractGenerator(new ObjectMapper());
    private final ProviderCallRetrier retrier = new ProviderCallRetrier(3, 1, 1, millis -> { });

    private final OutputSpecification sentiment = new OutputSpecification("sentiment", "Rate {{review}}",
            OutputType.CATEGORY, null,
            List.of(new OutputCategory("Positive", null), new OutputCategory("Negative", null)), null, true);
    private final OutputSpecification summary = new OutputSpecification("summary", "Summarize {{review}}",
            OutputType.TEXT, null, null, null, false);

    @Test
    void recordsValueAndReasoningForEachOutput() {
        RawResponse first = raw("s");
        RawResponse second = raw("t");
        when(handler.complete(eq("gpt-4o-mini"), eq("Rate Great"), anyDouble(), any())).thenReturn(first);
        when(handler.complete(eq("gpt-4o-mini"), eq("Summarize Great"), anyDouble(), any())).thenReturn(second);
        when(handler.usage(any())).thenReturn(Optional.of(new TokenUsage(10, 5, 15)));
        when(handler.parse(eq(first), eq(sentiment), any())).thenReturn(ParsedOutput.withReasoning("Positive", "Praise", "s"));
        when(handler.parse(eq(second), eq(summary), any())).thenReturn(ParsedOutput.of("Great", "t"));

        RowOutcome outcome = processor(sentiment, summary).process(new IndexedRow(0, Map.of("review", "Great")));

        assertThat(outcome.record().fields().keySet()).containsExactly("sentiment", "sentiment_reasoning", "summary");
        assertThat(outcome.record().get("sentiment")).isEqualTo("Positive");
        assertThat(outcome.record().get("sentiment_reasoning")).isEqualTo("Praise");
        assertThat(outcome.record().get("summary")).isEqualTo("Great");
        assertThat(outcome.usage()).isEqualTo(new TokenUsage(20, 10, 30));
        assertThat(outcome.successfulCalls()).isEqualTo(2);
        assertThat(outcome.failedOutputs()).isZero();
    }

    @Test
    void failedOutputDoesNotStopTheRow() {
        RawResponse second = raw("t");
        when(handler.complete(anyString(), eq("Rate Meh"), anyDouble(), any()))
                .thenThrow(new ProviderRequestException("HTTP 400", 400, null));
        when(handler.complete(anyString(), eq("Summarize Meh"), anyDouble(), any())).thenReturn(second);
        when(handler.usage(second)).thenReturn(Optional.empty());
        when(handler.parse(eq(second), eq(summary), any())).thenReturn(ParsedOutput.of("Meh", "t"));

        RowOutcome outcome = processor(sentiment, summary).process(new IndexedRow(2, Map.of("review", "Meh")));

        assertThat(outcome.record().get("sentiment")).isInstanceOf(EnrichmentError.class);
        assertThat(((EnrichmentError) outcome.record().get("sentiment")).kind())
                .isEqualTo(EnrichmentError.Kind.PROVIDER_REQUEST);
        assertThat(outcome.record().has("sentiment_reasoning")).isTrue();
        assertThat(outcome.record().get("sentiment_reasoning")).isNull();
        assertThat(outcome.record().get("summary")).isEqualTo("Meh");
        assertThat(outcome.failedOutputs()).isEqualTo(1);
        assertThat(outcome.successfulCalls()).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesBecomeTransientError() {
        when(handler.complete(anyString(), anyString(), anyDouble(), any()))
                .thenThrow(new ProviderTransientException("HTTP 429", 429, null));

        RowOutcome outcome = processor(summary).process(new IndexedRow(0, Map.of("review", "x")));

        verify(handler, times(3)).complete(anyString(), anyString(), anyDouble(), any());
        assertThat(((EnrichmentError) outcome.record().get("summary")).kind())
                .isEqualTo(EnrichmentError.Kind.PROVIDER_TRANSIENT);
    }

    @Test
    void templateErrorSkipsProviderCall() {
        OutputSpecification broken = new OutputSpecification("broken", "Use {{missing}}", OutputType.TEXT,
                null, null, List.of("review"), false);

        RowOutcome outcome = processor(broken).process(new IndexedRow(0, Map.of("review", "x")));

        verify(handler, never()).complete(anyString(), anyString(), anyDouble(), any());
        assertThat(((EnrichmentError) outcome.record().get("broken")).kind()).isEqualTo(EnrichmentError.Kind.TEMPLATE);
        assertThat(outcome.record().get("broken").toString()).startsWith("ERROR[template]: ");
    }

    @Test
    void unextractedValueBecomesExtractionError() {
        RawResponse response = raw("Hard to say");
        OutputSpecification plainSentiment = new OutputSpecification("sentiment", "Rate {{review}}",
                OutputType.CATEGORY, null, sentiment.categories(), null, false);
        when(handler.complete(anyString(), anyString(), anyDouble(), any())).thenReturn(response);
        when(handler.usage(response)).thenReturn(Optional.empty());
        when(handler.parse(eq(response), eq(plainSentiment), any())).thenReturn(ParsedOutput.notExtracted("Hard to say"));

        RowOutcome outcome = processor(plainSentiment).process(new IndexedRow(0, Map.of("review", "x")));

        EnrichmentError error = (EnrichmentError) outcome.record().get("sentiment");
        assertThat(error.kind()).isEqualTo(EnrichmentError.Kind.EXTRACTION);
        assertThat(error.rawContent()).isEqualTo("Hard to say");
    }

    @Test
    void emptyCategoryListFailsBeforeAnyCall() {
        OutputSpecification empty = new OutputSpecification("sentiment", "Rate", OutputType.CATEGORY,
                null, List.of(), null, false);

        assertThrows(ConfigurationException.class, () -> processor(empty));

        verify(handler, never()).complete(anyString(), anyString(), anyDouble(), any());
    }

    private RowProcessor processor(OutputSpecification... outputs) {
        TaskConfiguration config = new TaskConfiguration("main", "gpt-4o-mini", null, null, null,
                OutputFormat.NEW_COLUMNS, List.of("review"), List.of(outputs), null);
        return new RowProcessor(config, List.of("review"), handler, contractGenerator, retrier, true);
    }

    private RawResponse raw(String text) {
        return new RawResponse(text, true, "gpt-4o-mini", "stop", false, null, null, null, null);
    }
}
