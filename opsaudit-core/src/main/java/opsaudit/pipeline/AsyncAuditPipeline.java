package opsaudit.pipeline;

import opsaudit.AuditPipeline;
import opsaudit.InteractionRecord;
import opsaudit.retention.RetentionSweeper;
import opsaudit.spi.ConnectionProvider;
import opsaudit.spi.InteractionStore;
import opsaudit.spi.MetricsExporter;
import opsaudit.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asynchronous, batched audit pipeline: an {@link EntryQueue} drained by a fixed pool of
 * {@link BatchWorker}s that persist through a {@link BatchFlusher}, plus an optional
 * {@link RetentionSweeper}.
 *
 * <p>Nothing runs until {@link #start()}. {@link #close()} stops the workers (each flushes
 * its own batch), closes the queue, flushes what no worker claimed, and only then releases
 * the store resource. Usually obtained from {@link opsaudit.AuditPipelines}, which verifies
 * the store first.
 *
 * @see AsyncAuditPipeline.Builder
 */
public final class AsyncAuditPipeline implements AuditPipeline {
  private final EntryQueue queue;
  private final BatchFlusher flusher;
  private final int workerCount;
  private final int batchSize;
  private final Duration batchInterval;
  private final Duration drainTimeout;
  private final RetentionSweeper sweeper;
  private final AutoCloseable resource;
  private final MetricsExporter metrics;
  private final Logger logger;

  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile ExecutorService workers;

  private AsyncAuditPipeline(Builder builder) {
    ConnectionProvider connectionProvider =
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    InteractionStore store = Objects.requireNonNull(builder.store, "store");
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    requirePositive(builder.batchInterval, "batchInterval");
    requirePositive(builder.drainTimeout, "drainTimeout");

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.logger = builder.logger != null
        ? builder.logger : Logger.getLogger(AsyncAuditPipeline.class.getName());
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    this.queue = new EntryQueue(builder.queueCapacity, metrics, logger);
    this.flusher = new BatchFlusher(connectionProvider, store, clock, metrics, logger);
    this.workerCount = builder.workerCount;
    this.batchSize = builder.batchSize;
    this.batchInterval = builder.batchInterval;
    this.drainTimeout = builder.drainTimeout;
    this.sweeper = builder.sweeper;
    this.resource = builder.resource;
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the workers and, if configured, the retention sweeper. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the pipeline has been closed
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("AsyncAuditPipeline has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("opsaudit-worker-", logger));
    for (int i = 1; i <= workerCount; i++) {
      workers.submit(new BatchWorker(i, queue, flusher, batchSize, batchInterval, running, logger));
    }
    if (sweeper != null) {
      sweeper.start();
    }
    logger.log(Level.INFO, "Audit pipeline started: workers={0}, queueCapacity={1}, batchSize={2}, "
        + "batchInterval={3}, retention={4}",
        new Object[]{workerCount, queue.capacity(), batchSize, batchInterval, sweeper != null});
  }

  @Override
  public void submit(InteractionRecord record) {
    if (record == null) {
      logger.warning("Ignoring null interaction record");
      return;
    }
    try {
      queue.offer(record);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to enqueue interactionId=" + record.interactionId(), e);
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  /** Current number of queued records. */
  public int queueDepth() {
    return queue.depth();
  }

  public long droppedCount() {
    return queue.droppedCount();
  }

  public long acceptedCount() {
    return queue.acceptedCount();
  }

  /**
   * Shuts the pipeline down: cancels the workers and the sweeper, waits up to the drain
   * timeout for the workers' final flushes, closes the queue, flushes the records no worker
   * claimed in batches, then closes the store resource and the metrics exporter. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.info("Audit pipeline shutting down");
    running.set(false);
    if (sweeper != null) {
      try {
        sweeper.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Retention sweeper did not stop cleanly", e);
      }
    }
    awaitWorkers();

    queue.close();
    List<InteractionRecord> remaining = queue.drain();
    if (!remaining.isEmpty()) {
      logger.log(Level.INFO, "Flushing {0} queued audit records", remaining.size());
      for (int from = 0; from < remaining.size(); from += batchSize) {
        flusher.flush(remaining.subList(from, Math.min(from + batchSize, remaining.size())));
      }
    }

    closeQuietly(resource, "audit store");
    if (metrics instanceof AutoCloseable closeableMetrics) {
      closeQuietly(closeableMetrics, "metrics exporter");
    }
    logger.info("Audit pipeline closed");
  }

  private void awaitWorkers() {
    // close() may run on a shutdown hook rather than the thread that called start()
    ExecutorService pool = workers;
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting audit workers. Queued: {0}",
            queue.depth());
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void closeQuietly(AutoCloseable closeable, String what) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close " + what, e);
    }
  }

  /** Builder for {@link AsyncAuditPipeline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private InteractionStore store;
    private int workerCount = 2;
    private int queueCapacity = 1000;
    private int batchSize = 10;
    private Duration batchInterval = Duration.ofSeconds(5);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private RetentionSweeper sweeper;
    private AutoCloseable resource;
    private MetricsExporter metrics;
    private Logger logger;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the connection provider used for every batch transaction.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store that writes the rows of each record.
     *
     * <p><b>Required.</b>
     *
     * @param store the persistence backend
     * @return this builder
     */
    public Builder store(InteractionStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
     *
     * @param workerCount number of workers
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the entry queue.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity max queued records
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the number of records that triggers an immediate flush.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param batchSize records per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the period after which a worker flushes a partial batch.
     *
     * <p>Optional. Defaults to {@code 5s}.
     *
     * @param batchInterval flush period
     * @return this builder
     */
    public Builder batchInterval(Duration batchInterval) {
      this.batchInterval = batchInterval;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for workers before interrupting them.
     *
     * <p>Optional. Defaults to {@code 30s}.
     *
     * @param drainTimeout max wait for workers on close
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets a retention sweeper started and closed together with the pipeline.
     *
     * <p>Optional.
     *
     * @param sweeper the sweeper, not yet started
     * @return this builder
     */
    public Builder sweeper(RetentionSweeper sweeper) {
      this.sweeper = sweeper;
      return this;
    }

    /**
     * Sets a resource closed after the final flush, typically the connection pool.
     *
     * <p>Optional.
     *
     * @param resource resource owned by the pipeline
     * @return this builder
     */
    public Builder resource(AutoCloseable resource) {
      this.resource = resource;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the logger used by the queue, the workers and the flusher.
     *
     * <p>Optional. Defaults to this class's logger.
     *
     * @param logger the logger
     * @return this builder
     */
    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Sets the clock that stamps {@code created_at} on written rows.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the pipeline without starting it.
     *
     * @return a new pipeline; call {@link AsyncAuditPipeline#start()} to run it
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a setting is out of range
     */
    public AsyncAuditPipeline build() {
      return new AsyncAuditPipeline(this);
    }
  }
}
