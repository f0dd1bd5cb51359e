package app.magicrows.enrichment.service;

import app.magicrows.enrichment.error.ConfigurationException;
import app.magicrows.enrichment.provider.TokenUsage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchSchedulerTest {

    @Mock
    RowProcessor processor;

    @Test
    void outcomesKeepRowOrderAndProgressIsReportedPerBatch() {
        when(processor.process(any())).thenAnswer(invocation -> {
            IndexedRow row = invocation.getArgument(0);
            Thread.sleep(5L * (5 - row.rowIndex()));
            return outcome(row.rowIndex());
        });
        List<BatchProgress> progress = new CopyOnWriteArrayList<>();
        BatchScheduler scheduler = new BatchScheduler(2, progress::add);

        BatchRunResult result = scheduler.run(rows(5), processor);

        assertThat(result.outcomes()).extracting(RowOutcome::rowIndex).containsExactly(0, 1, 2, 3, 4);
        assertThat(result.batches()).isEqualTo(3);
        assertThat(progress).containsExactly(
                new BatchProgress(1, 3, 2, 5),
                new BatchProgress(2, 3, 4, 5),
                new BatchProgress(3, 3, 5, 5));
        assertThat(result.totals().rows()).isEqualTo(5);
        assertThat(result.totals().successfulCalls()).isEqualTo(5);
        assertThat(result.totals().usage()).isEqualTo(new TokenUsage(50, 25, 75));
        assertThat(result.totals().providerTime()).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void nextBatchStartsOnlyAfterCurrentBatchFinishes() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger finished = new AtomicInteger();
        List<Integer> finishedWhenStarted = new CopyOnWriteArrayList<>(new Integer[6]);
        when(processor.process(any())).thenAnswer(invocation -> {
            IndexedRow row = invocation.getArgument(0);
            finishedWhenStarted.set(row.rowIndex(), finished.get());
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            finished.incrementAndGet();
            return outcome(row.rowIndex());
        });

        new BatchScheduler(3, progress -> { }).run(rows(6), processor);

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
        for (int i = 3; i < 6; i++) {
            assertThat(finishedWhenStarted.get(i)).isGreaterThanOrEqualTo(3);
        }
    }

    @Test
    void configurationErrorAbortsTheRun() {
        when(processor.process(any())).thenThrow(new ConfigurationException("bad output"));

        assertThrows(ConfigurationException.class, () -> new BatchScheduler(10, null).run(rows(2), processor));
    }

    @Test
    void noRowsMeansNoBatches() {
        BatchRunResult result = new BatchScheduler(10, null).run(List.of(), processor);

        assertThat(result.batches()).isZero();
        assertThat(result.outcomes()).isEmpty();
    }

    private List<IndexedRow> rows(int count) {
        List<IndexedRow> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(new IndexedRow(i, Map.of("id", i)));
        }
        return rows;
    }

    private RowOutcome outcome(int rowIndex) {
        return new RowOutcome(rowIndex, new RowRecord(rowIndex), new TokenUsage(10, 5, 15),
                Duration.ofMillis(10), 1, 0);
    }
}
