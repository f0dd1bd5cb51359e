package app.magicrows.enrichment.service;

import app.magicrows.enrichment.config.EnrichmentProps;
import app.magicrows.enrichment.contract.ContractGenerator;
import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.domain.RunMode;
import app.magicrows.enrichment.domain.TaskConfiguration;
import app.magicrows.enrichment.provider.ProviderHandler;
import app.magicrows.enrichment.provider.ProviderHandlerFactory;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.ProviderRegistry;
import app.magicrows.enrichment.table.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final ProviderRegistry registry;
    private final ProviderHandlerFactory handlerFactory;
    private final ContractGenerator contractGenerator;
    private final ResultAssembler resultAssembler = new ResultAssembler();
    private final EnrichmentProps props;
    private final Sleeper sleeper;

    public EnrichmentService(Collection<ProviderProfile> profiles,
                             ProviderHandlerFactory handlerFactory,
                             ContractGenerator contractGenerator,
                             EnrichmentProps props) {
        this(profiles, handlerFactory, contractGenerator, props, Sleeper.THREAD);
    }

    EnrichmentService(Collection<ProviderProfile> profiles,
                      ProviderHandlerFactory handlerFactory,
                      ContractGenerator contractGenerator,
                      EnrichmentProps props,
                      Sleeper sleeper) {
        this.registry = new ProviderRegistry(profiles);
        this.handlerFactory = handlerFactory;
        this.contractGenerator = contractGenerator;
        this.props = props.normalized();
        this.sleeper = sleeper;
    }

    public DataTable enrich(DataTable table, TaskConfiguration config, EnrichmentOptions options) {
        return run(table, config, options).table();
    }

    public EnrichmentRun run(DataTable table, TaskConfiguration config, EnrichmentOptions options) {
        EnrichmentOptions effective = options == null ? EnrichmentOptions.defaults() : options;
        long started = System.nanoTime();
        ProviderProfile profile = checkProvider(config);
        warnMissingContextColumns(table, config);

        ProviderHandler handler = handlerFactory.create(profile, effective.logPayloads());
        ProviderCallRetrier retrier = new ProviderCallRetrier(
                props.maxAttempts(), props.retryInitialDelayMs(), props.retryMaxDelayMs(), sleeper);
        RowProcessor processor = new RowProcessor(
                config, table.columns(), handler, contractGenerator, retrier, effective.includeReasoning());

        int limit = config.rowLimit(table.rowCount());
        if (config.mode() == RunMode.PREVIEW && limit < table.rowCount()) {
            log.info("Preview mode processing rows={} of totalRows={}", limit, table.rowCount());
        }
        List<IndexedRow> rows = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            rows.add(new IndexedRow(i, table.row(i)));
        }

        log.info("Enrichment started provider={} type={} model={} outputs={} rows={} format={}",
                profile.name(), profile.type().value(), config.model(), config.outputs().size(),
                limit, config.outputFormat().value());

        BatchScheduler scheduler = new BatchScheduler(props.batchSize(), effective.progressListener());
        BatchRunResult result = scheduler.run(rows, processor);
        DataTable enriched = resultAssembler.assemble(table, result.records(), config, effective.includeReasoning());

        RunSummary summary = RunSummary.of(
                result,
                Duration.ofNanos(System.nanoTime() - started),
                props.inputCostPerMillion(),
                props.outputCostPerMillion(),
                config.budget()
        );
        if (effective.logSummary()) {
            logSummary(summary);
        }
        if (summary.budgetExceeded()) {
            log.warn("Estimated cost exceeds budget cost={} budget={}", summary.estimatedCost(), summary.budget());
        }
        return new EnrichmentRun(enriched, summary);
    }

    public ProviderProfile checkProvider(TaskConfiguration config) {
        return registry.require(config.providerName());
    }

    private void warnMissingContextColumns(DataTable table, TaskConfiguration config) {
        Set<String> referenced = new LinkedHashSet<>(config.contextColumns());
        for (OutputSpecification output : config.outputs()) {
            referenced.addAll(output.contextColumns());
        }
        for (String column : referenced) {
            if (!table.hasColumn(column)) {
                log.warn("Context column not found in input table column={}", column);
            }
        }
    }

    private void logSummary(RunSummary summary) {
        log.info("Enrichment finished rows={} batches={} calls={} failedOutputs={} wallTimeMs={} providerTimeMs={}",
                summary.rowsProcessed(), summary.batches(), summary.successfulCalls(), summary.failedOutputs(),
                summary.wallTime().toMillis(), summary.providerTime().toMillis());
        log.info("Token usage promptTokens={} completionTokens={} totalTokens={} estimatedCost={}",
                summary.usage().promptTokens(), summary.usage().completionTokens(),
                summary.usage().totalTokens(), summary.estimatedCost());
    }
}
