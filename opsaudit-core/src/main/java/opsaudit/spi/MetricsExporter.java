package opsaudit.spi;

/**
 * Observability hook for exporting audit pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of records accepted by the entry queue.
     */
    void incrementAccepted();

    /**
     * Increments the count of records dropped because the entry queue was full or closed.
     */
    void incrementDropped();

    /**
     * Adds the records of a committed batch.
     *
     * @param records number of records in the batch
     */
    void incrementBatchCommitted(int records);

    /**
     * Adds the records of a batch that was rolled back and discarded.
     *
     * @param records number of records in the batch
     */
    void incrementBatchFailed(int records);

    /**
     * Records the current depth of the entry queue.
     *
     * @param depth number of queued records
     */
    void recordQueueDepth(int depth);

    /**
     * Counts a completed retention sweep.
     *
     * @param deleted number of interactions removed
     */
    default void incrementSweepCompleted(int deleted) {
    }

    /**
     * Counts a retention sweep that was rolled back.
     */
    default void incrementSweepFailed() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAccepted() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementBatchCommitted(int records) {
        }

        @Override
        public void incrementBatchFailed(int records) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
