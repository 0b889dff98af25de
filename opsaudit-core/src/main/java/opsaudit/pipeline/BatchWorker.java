package opsaudit.pipeline;

import opsaudit.InteractionRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One worker loop: collects records from the {@link EntryQueue} into a private batch and hands
 * it to the {@link BatchFlusher} when it is full or when the worker's tick fires.
 *
 * <p>The running flag is checked between iterations only, never during a flush. Once it is
 * cleared the worker flushes what it holds and returns.
 */
final class BatchWorker implements Runnable {
  // upper bound on a single poll so that shutdown is noticed promptly
  private static final long MAX_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

  private final int id;
  private final EntryQueue queue;
  private final BatchFlusher flusher;
  private final int batchSize;
  private final long intervalNanos;
  private final AtomicBoolean running;
  private final Logger logger;

  BatchWorker(int id, EntryQueue queue, BatchFlusher flusher, int batchSize,
      Duration batchInterval, AtomicBoolean running, Logger logger) {
    this.id = id;
    this.queue = queue;
    this.flusher = flusher;
    this.batchSize = batchSize;
    this.intervalNanos = batchInterval.toNanos();
    this.running = running;
    this.logger = logger;
  }

  @Override
  public void run() {
    logger.log(Level.FINE, "Audit worker {0} started", id);
    List<InteractionRecord> batch = new ArrayList<>(batchSize);
    long nextTick = System.nanoTime() + intervalNanos;
    while (running.get()) {
      try {
        long wait = Math.min(nextTick - System.nanoTime(), MAX_POLL_NANOS);
        InteractionRecord record = queue.poll(Math.max(wait, 0L), TimeUnit.NANOSECONDS);
        if (record != null) {
          batch.add(record);
          if (batch.size() >= batchSize) {
            flush(batch);
          }
        }
        long now = System.nanoTime();
        if (now - nextTick >= 0) {
          flush(batch);
          nextTick += intervalNanos;
          if (now - nextTick >= 0) {
            nextTick = now + intervalNanos;
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Audit worker " + id + " loop error", t);
      }
    }
    try {
      flush(batch);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Audit worker " + id + " final flush failed", t);
    }
    logger.log(Level.FINE, "Audit worker {0} stopped", id);
  }

  private void flush(List<InteractionRecord> batch) {
    if (batch.isEmpty()) {
      return;
    }
    try {
      flusher.flush(List.copyOf(batch));
    } finally {
      batch.clear();
    }
  }
}
