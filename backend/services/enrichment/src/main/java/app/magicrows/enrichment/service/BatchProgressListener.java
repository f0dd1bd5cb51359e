package app.magicrows.enrichment.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@FunctionalInterface
public interface BatchProgressListener {

    void onBatchComplete(BatchProgress progress);

    static BatchProgressListener logging() {
        Logger log = LoggerFactory.getLogger(BatchScheduler.class);
        return progress -> log.info("Batch completed batch={}/{} rows={}/{}",
                progress.batchNumber(), progress.totalBatches(), progress.rowsDone(), progress.totalRows());
    }
}
