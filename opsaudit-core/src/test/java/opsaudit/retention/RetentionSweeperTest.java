package opsaudit.retention;

import opsaudit.InMemoryAuditStore;
import opsaudit.RecordingMetrics;
import opsaudit.spi.InteractionPurger;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetentionSweeperTest {
  private static final Instant NOW = Instant.parse("2026-03-10T02:59:59.700Z");

  private final InMemoryAuditStore store = new InMemoryAuditStore();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private RetentionSweeper.Builder sweeper(InteractionPurger purger) {
    return RetentionSweeper.builder()
        .connectionProvider(store)
        .purger(purger)
        .retentionDays(30)
        .zone(ZoneOffset.UTC)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .metrics(metrics);
  }

  @Test
  void builderRejectsMissingCollaboratorsAndZeroDays() {
    assertThrows(NullPointerException.class, () -> RetentionSweeper.builder().purger((c, b) -> 0).build());
    assertThrows(NullPointerException.class, () -> RetentionSweeper.builder().connectionProvider(store).build());
    assertThrows(IllegalArgumentException.class, () -> sweeper((c, b) -> 0).retentionDays(0).build());
  }

  @Test
  void runOnceUsesCutoffAndCommits() {
    List<Instant> cutoffs = new CopyOnWriteArrayList<>();
    RetentionSweeper sweeper = sweeper((conn, before) -> {
      cutoffs.add(before);
      return 7;
    }).build();

    assertEquals(7, sweeper.runOnce());

    assertEquals(List.of(NOW.minus(Duration.ofDays(30))), cutoffs);
    assertEquals(1, store.commits.get());
    assertEquals(1, metrics.sweepsCompleted.get());
    assertEquals(7, metrics.sweptInteractions.get());
  }

  @Test
  void cutoffCountsCalendarDaysAcrossDaylightSavingChange() {
    // 2026-03-08 moves New York from UTC-5 to UTC-4
    Instant now = Instant.parse("2026-03-10T12:00:00Z");
    List<Instant> cutoffs = new CopyOnWriteArrayList<>();
    RetentionSweeper sweeper = sweeper((conn, before) -> {
      cutoffs.add(before);
      return 0;
    })
        .zone(ZoneId.of("America/New_York"))
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .build();

    sweeper.runOnce();

    assertEquals(List.of(Instant.parse("2026-02-08T13:00:00Z")), cutoffs);
  }

  @Test
  void failedRunRollsBackAndReportsMinusOne() {
    RetentionSweeper sweeper = sweeper((conn, before) -> {
      throw new IllegalStateException("lock timeout");
    }).build();

    assertEquals(-1, sweeper.runOnce());

    assertEquals(1, store.rollbacks.get());
    assertEquals(0, store.commits.get());
    assertEquals(1, metrics.sweepsFailed.get());
  }

  @Test
  void unreachableStoreReportsMinusOne() {
    store.unreachable(true);

    assertEquals(-1, sweeper((conn, before) -> 0).build().runOnce());
    assertEquals(1, metrics.sweepsFailed.get());
  }

  @Test
  void malformedCleanupTimeFallsBackToThreeAm() {
    assertEquals(LocalTime.of(3, 0), sweeper((c, b) -> 0).cleanupTime("half past two").build().cleanupTime());
    assertEquals(LocalTime.of(22, 15), sweeper((c, b) -> 0).cleanupTime("22:15").build().cleanupTime());
  }

  @Test
  void firesAtCleanupTimeThenSchedulesNextDay() throws Exception {
    CountDownLatch ran = new CountDownLatch(1);
    RetentionSweeper sweeper = sweeper((conn, before) -> {
      ran.countDown();
      return 0;
    }).cleanupTime("03:00").build();
    assertNull(sweeper.nextRunAt());

    sweeper.start();
    try {
      assertEquals(ZonedDateTime.parse("2026-03-10T03:00Z"), sweeper.nextRunAt());
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      long deadline = System.currentTimeMillis() + 2_000;
      while (!ZonedDateTime.parse("2026-03-11T03:00Z").equals(sweeper.nextRunAt())
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(ZonedDateTime.parse("2026-03-11T03:00Z"), sweeper.nextRunAt());
      assertEquals(1, metrics.sweepsCompleted.get());
    } finally {
      sweeper.close();
    }
  }

  @Test
  void closeIsIdempotentAndPreventsRestart() {
    RetentionSweeper sweeper = sweeper((c, b) -> 0).build();
    sweeper.start();
    sweeper.start();

    sweeper.close();
    assertDoesNotThrow(sweeper::close);
    assertThrows(IllegalStateException.class, sweeper::start);
  }
}
