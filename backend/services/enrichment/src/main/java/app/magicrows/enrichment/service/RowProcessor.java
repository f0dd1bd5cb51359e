package app.magicrows.enrichment.service;

import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.TaskConfiguration;
import app.magicrows.enrichment.error.ConfigurationException;
import app.magicrows.enrichment.error.EnrichmentError;
import app.magicrows.enrichment.error.EnrichmentException;
import app.magicrows.enrichment.prompt.PromptBuilder;
import app.magicrows.enrichment.provider.ParsedOutput;
import app.magicrows.enrichment.provider.ProviderHandler;
import app.magicrows.enrichment.provider.RawResponse;
import app.magicrows.enrichment.provider.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every output of a task against one row. Prompt builders and output contracts are
 * prepared once at construction, so an invalid output definition fails before any provider
 * call. Instances are shared by concurrent row tasks and hold no per-row state.
 */
public class RowProcessor {

    private static final Logger log = LoggerFactory.getLogger(RowProcessor.class);

    private final TaskConfiguration config;
    private final ProviderHandler handler;
    private final ProviderCallRetrier retrier;
    private final List<OutputPlan> plans;

    public RowProcessor(TaskConfiguration config,
                        List<String> tableColumns,
                        ProviderHandler handler,
                        ContractGenerator contractGenerator,
                        ProviderCallRetrier retrier,
                        boolean reasoningOverride) {
        this.config = config;
        this.handler = handler;
        this.retrier = retrier;
        List<OutputPlan> prepared = new ArrayList<>();
        for (OutputSpecification output : config.outputs()) {
            OutputContract contract = contractGenerator.generate(output, reasoningOverride);
            List<String> contextColumns = output.resolveContextColumns(config.contextColumns());
            if (contextColumns.isEmpty()) {
                contextColumns = tableColumns;
            }
            PromptBuilder builder = new PromptBuilder(output, contextColumns, contract.withReasoning());
            prepared.add(new OutputPlan(output, builder, contract));
        }
        this.plans = List.copyOf(prepared);
    }

    public RowOutcome process(IndexedRow row) {
        int rowIndex = row.rowIndex();
        RowRecord record = new RowRecord(rowIndex);
        TokenUsage usage = TokenUsage.ZERO;
        long providerNanos = 0;
        int successfulCalls = 0;
        int failedOutputs = 0;

        for (OutputPlan plan : plans) {
            OutputSpecification output = plan.output();
            try {
                String prompt = plan.builder().build(row.values(), rowIndex);
                long started = System.nanoTime();
                RawResponse response;
                try {
                    response = retrier.call("rowIndex=" + rowIndex + " output=" + output.name(),
                            () -> handler.complete(config.model(), prompt, config.temperature(), plan.contract()));
                } finally {
                    providerNanos += System.nanoTime() - started;
                }
                successfulCalls++;
                usage = usage.plus(handler.usage(response).orElse(null));

                ParsedOutput parsed = handler.parse(response, output, plan.contract());
                if (!parsed.extracted()) {
                    failedOutputs++;
                    log.warn("Extraction failed rowIndex={} output={}", rowIndex, output.name());
                    recordError(record, plan, EnrichmentError.extraction(
                            "No " + output.type().value() + " value could be extracted for output '" + output.name() + "'",
                            parsed.rawContent()));
                    continue;
                }
                record.put(output.name(), parsed.value());
                if (plan.contract().withReasoning()) {
                    record.put(output.reasoningField(), parsed.reasoning());
                }
            } catch (ConfigurationException ex) {
                throw ex;
            } catch (EnrichmentException ex) {
                failedOutputs++;
                log.warn("Output failed rowIndex={} output={} errorType={} message={}",
                        rowIndex, output.name(), ex.getClass().getSimpleName(), ProviderCallRetrier.safeMessage(ex));
                recordError(record, plan, EnrichmentError.from(ex));
            } catch (RuntimeException ex) {
                failedOutputs++;
                log.error("Unexpected failure rowIndex={} output={}", rowIndex, output.name(), ex);
                recordError(record, plan, new EnrichmentError(
                        EnrichmentError.Kind.INTERNAL, ProviderCallRetrier.safeMessage(ex), null));
            }
        }
        return new RowOutcome(rowIndex, record, usage, Duration.ofNanos(providerNanos), successfulCalls, failedOutputs);
    }

    private void recordError(RowRecord record, OutputPlan plan, EnrichmentError error) {
        record.put(plan.output().name(), error);
        if (plan.contract().withReasoning()) {
            record.put(plan.output().reasoningField(), null);
        }
    }

    private record OutputPlan(OutputSpecification output, PromptBuilder builder, OutputContract contract) {
    }
}
