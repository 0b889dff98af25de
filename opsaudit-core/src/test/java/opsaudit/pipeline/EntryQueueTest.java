package opsaudit.pipeline;

import opsaudit.InteractionRecord;
import opsaudit.Records;
import opsaudit.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryQueueTest {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final Logger logger = Logger.getLogger(EntryQueueTest.class.getName());

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new EntryQueue(0, metrics, logger));
  }

  @Test
  void fullQueueDropsWithoutBlocking() {
    EntryQueue queue = new EntryQueue(1, metrics, logger);

    assertTrue(queue.offer(Records.record()));
    long start = System.nanoTime();
    assertFalse(queue.offer(Records.record()));
    assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(500));

    assertEquals(1, queue.depth());
    assertEquals(1, queue.acceptedCount());
    assertEquals(1, queue.droppedCount());
    assertEquals(1, metrics.accepted.get());
    assertEquals(1, metrics.dropped.get());
  }

  @Test
  void drainReturnsRecordsInSubmissionOrder() {
    EntryQueue queue = new EntryQueue(10, metrics, logger);
    InteractionRecord a = Records.record();
    InteractionRecord b = Records.record();
    InteractionRecord c = Records.record();
    queue.offer(a);
    queue.offer(b);
    queue.offer(c);

    assertEquals(List.of(a, b, c), queue.drain());
    assertEquals(0, queue.depth());
    assertEquals(0, metrics.lastDepth);
  }

  @Test
  void closedQueueRefusesRecords() {
    EntryQueue queue = new EntryQueue(10, metrics, logger);
    queue.offer(Records.record());
    queue.close();
    queue.close();

    assertTrue(queue.isClosed());
    assertFalse(queue.offer(Records.record()));
    assertEquals(1, queue.droppedCount());
    assertEquals(1, queue.drain().size());
  }

  @Test
  void concurrentProducersNeverExceedCapacity() throws Exception {
    int capacity = 50;
    EntryQueue queue = new EntryQueue(capacity, metrics, logger);
    ExecutorService producers = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    AtomicInteger accepted = new AtomicInteger();
    try {
      for (int t = 0; t < 8; t++) {
        producers.submit(() -> {
          go.await();
          for (int i = 0; i < 100; i++) {
            if (queue.offer(Records.record())) {
              accepted.incrementAndGet();
            }
          }
          return null;
        });
      }
      go.countDown();
      producers.shutdown();
      assertTrue(producers.awaitTermination(10, TimeUnit.SECONDS));
    } finally {
      producers.shutdownNow();
    }

    assertEquals(capacity, accepted.get());
    assertEquals(capacity, queue.depth());
    assertEquals(800 - capacity, queue.droppedCount());
  }
}
