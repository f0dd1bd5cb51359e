package app.magicrows.enrichment.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final int batchSize;
    private final BatchProgressListener listener;

    public BatchScheduler(int batchSize, BatchProgressListener listener) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
        this.listener = listener == null ? BatchProgressListener.logging() : listener;
    }

    public BatchRunResult run(List<IndexedRow> rows, RowProcessor processor) {
        UsageAccumulator totals = new UsageAccumulator();
        if (rows.isEmpty()) {
            return new BatchRunResult(List.of(), totals, 0);
        }
        int totalRows = rows.size();
        int totalBatches = (totalRows + batchSize - 1) / batchSize;
        List<RowOutcome> outcomes = new ArrayList<>(totalRows);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batchSize, totalRows), workerThreads());
        try {
            for (int batch = 0; batch < totalBatches; batch++) {
                int from = batch * batchSize;
                List<IndexedRow> slice = rows.subList(from, Math.min(from + batchSize, totalRows));
                log.debug("Starting batch batch={}/{} rows={}", batch + 1, totalBatches, slice.size());

                List<CompletableFuture<RowOutcome>> futures = new ArrayList<>(slice.size());
                for (IndexedRow row : slice) {
                    futures.add(CompletableFuture.supplyAsync(() -> processor.process(row), executor));
                }

                RuntimeException failure = null;
                for (CompletableFuture<RowOutcome> future : futures) {
                    try {
                        RowOutcome outcome = future.join();
                        outcomes.add(outcome);
                        totals.add(outcome);
                    } catch (CompletionException ex) {
                        if (failure == null) {
                            failure = unwrap(ex);
                        }
                    }
                }
                if (failure != null) {
                    throw failure;
                }
                listener.onBatchComplete(new BatchProgress(batch + 1, totalBatches, outcomes.size(), totalRows));
            }
        } finally {
            executor.shutdownNow();
        }
        return new BatchRunResult(List.copyOf(outcomes), totals, totalBatches);
    }

    private static RuntimeException unwrap(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return ex;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "enrichment-row-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
