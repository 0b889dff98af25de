package opsaudit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import opsaudit.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code opsaudit.submit.accepted} - records taken into the entry queue</li>
 *   <li>{@code opsaudit.submit.dropped} - records dropped (queue full or closed)</li>
 *   <li>{@code opsaudit.batch.committed} - batches committed</li>
 *   <li>{@code opsaudit.batch.failed} - batches rolled back and discarded</li>
 *   <li>{@code opsaudit.records.committed} - records in committed batches</li>
 *   <li>{@code opsaudit.records.failed} - records in discarded batches</li>
 *   <li>{@code opsaudit.sweep.completed} - retention sweeps committed</li>
 *   <li>{@code opsaudit.sweep.failed} - retention sweeps rolled back</li>
 *   <li>{@code opsaudit.sweep.deleted} - interactions removed by retention</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code opsaudit.queue.depth} - records waiting in the entry queue</li>
 * </ul>
 *
 * <p>Closing the pipeline closes this exporter, which removes its meters from the registry.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter accepted;
  private final Counter dropped;
  private final Counter batchesCommitted;
  private final Counter batchesFailed;
  private final Counter recordsCommitted;
  private final Counter recordsFailed;
  private final Counter sweepsCompleted;
  private final Counter sweepsFailed;
  private final Counter sweepDeleted;
  private final Gauge depthGauge;

  private final AtomicInteger depth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "opsaudit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "opsaudit");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "assistant.audit"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.accepted = Counter.builder(namePrefix + ".submit.accepted")
        .description("Records taken into the entry queue")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".submit.dropped")
        .description("Records dropped (queue full or closed)")
        .register(registry);
    this.batchesCommitted = Counter.builder(namePrefix + ".batch.committed")
        .description("Batches committed")
        .register(registry);
    this.batchesFailed = Counter.builder(namePrefix + ".batch.failed")
        .description("Batches rolled back and discarded")
        .register(registry);
    this.recordsCommitted = Counter.builder(namePrefix + ".records.committed")
        .description("Records in committed batches")
        .register(registry);
    this.recordsFailed = Counter.builder(namePrefix + ".records.failed")
        .description("Records in discarded batches")
        .register(registry);
    this.sweepsCompleted = Counter.builder(namePrefix + ".sweep.completed")
        .description("Retention sweeps committed")
        .register(registry);
    this.sweepsFailed = Counter.builder(namePrefix + ".sweep.failed")
        .description("Retention sweeps rolled back")
        .register(registry);
    this.sweepDeleted = Counter.builder(namePrefix + ".sweep.deleted")
        .description("Interactions removed by retention")
        .register(registry);

    this.depthGauge = Gauge.builder(namePrefix + ".queue.depth", depth, AtomicInteger::get)
        .description("Records waiting in the entry queue")
        .register(registry);
  }

  @Override
  public void incrementAccepted() {
    if (closed) return;
    accepted.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementBatchCommitted(int records) {
    if (closed) return;
    batchesCommitted.increment();
    recordsCommitted.increment(records);
  }

  @Override
  public void incrementBatchFailed(int records) {
    if (closed) return;
    batchesFailed.increment();
    recordsFailed.increment(records);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    this.depth.set(depth);
  }

  @Override
  public void incrementSweepCompleted(int deleted) {
    if (closed) return;
    sweepsCompleted.increment();
    sweepDeleted.increment(deleted);
  }

  @Override
  public void incrementSweepFailed() {
    if (closed) return;
    sweepsFailed.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(accepted, dropped, batchesCommitted, batchesFailed,
        recordsCommitted, recordsFailed, sweepsCompleted, sweepsFailed, sweepDeleted, depthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
