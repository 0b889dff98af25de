package opsaudit.pipeline;

import opsaudit.InteractionRecord;
import opsaudit.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded FIFO buffer between request handlers and the batch workers.
 *
 * <p>{@link #offer} never blocks: when the queue is full the record is dropped, counted and
 * logged. After {@link #close()} no record is accepted any more, so a subsequent
 * {@link #drain()} returns everything that will ever be in the queue.
 */
public final class EntryQueue {
  private final BlockingQueue<InteractionRecord> queue;
  private final int capacity;
  private final MetricsExporter metrics;
  private final Logger logger;

  // producers share the read lock; close() takes the write lock once
  private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
  private final AtomicBoolean loggedClosedDrop = new AtomicBoolean();
  private volatile boolean accepting = true;

  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  public EntryQueue(int capacity, MetricsExporter metrics, Logger logger) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Enqueues {@code record} if there is room.
   *
   * @param record the record to enqueue
   * @return {@code true} if the record was accepted, {@code false} if it was dropped
   */
  public boolean offer(InteractionRecord record) {
    Objects.requireNonNull(record, "record");
    if (!closeLock.readLock().tryLock()) {
      return dropClosed(record);
    }
    try {
      if (!accepting) {
        return dropClosed(record);
      }
      if (queue.offer(record)) {
        accepted.incrementAndGet();
        metrics.incrementAccepted();
        metrics.recordQueueDepth(queue.size());
        return true;
      }
    } finally {
      closeLock.readLock().unlock();
    }
    dropped.incrementAndGet();
    metrics.incrementDropped();
    logger.log(Level.WARNING, "Audit queue full (capacity={0}); dropped interactionId={1}, model={2}",
        new Object[]{capacity, record.interactionId(), record.modelName()});
    return false;
  }

  private boolean dropClosed(InteractionRecord record) {
    dropped.incrementAndGet();
    metrics.incrementDropped();
    if (loggedClosedDrop.compareAndSet(false, true)) {
      logger.log(Level.FINE, "Audit queue closed; dropped interactionId={0}", record.interactionId());
    }
    return false;
  }

  /**
   * Waits up to {@code timeout} for the next record.
   *
   * @return the next record, or {@code null} if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  InteractionRecord poll(long timeout, TimeUnit unit) throws InterruptedException {
    InteractionRecord record = queue.poll(timeout, unit);
    if (record != null) {
      metrics.recordQueueDepth(queue.size());
    }
    return record;
  }

  /** Refuses every later {@link #offer}. Idempotent. */
  public void close() {
    closeLock.writeLock().lock();
    try {
      accepting = false;
    } finally {
      closeLock.writeLock().unlock();
    }
  }

  public boolean isClosed() {
    return !accepting;
  }

  /**
   * Removes and returns every queued record in FIFO order.
   *
   * @return the records still queued, possibly empty
   */
  public List<InteractionRecord> drain() {
    List<InteractionRecord> remaining = new ArrayList<>(queue.size());
    queue.drainTo(remaining);
    metrics.recordQueueDepth(queue.size());
    return remaining;
  }

  public int depth() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  public long acceptedCount() {
    return accepted.get();
  }

  public long droppedCount() {
    return dropped.get();
  }
}
