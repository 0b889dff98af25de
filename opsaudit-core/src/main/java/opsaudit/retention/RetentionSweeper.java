package opsaudit.retention;

import opsaudit.spi.ConnectionProvider;
import opsaudit.spi.InteractionPurger;
import opsaudit.spi.MetricsExporter;
import opsaudit.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Daily job that deletes interactions older than the retention period.
 *
 * <p>Each run is a one-shot task scheduled for the next occurrence of the configured time of
 * day; after every run, successful or not, the next day's run is scheduled. A run deletes
 * inside a single transaction, so an interrupted or failed run leaves nothing half-deleted.
 * Failures are logged and counted and wait for the next day.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see InteractionPurger
 * @see DailySchedule
 */
public final class RetentionSweeper implements AutoCloseable {
  static final LocalTime DEFAULT_CLEANUP_TIME = LocalTime.of(3, 0);

  private final ConnectionProvider connectionProvider;
  private final InteractionPurger purger;
  private final int retentionDays;
  private final LocalTime cleanupTime;
  private final ZoneId zone;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Logger logger;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> nextTask;
  private volatile ZonedDateTime nextRunAt;
  private volatile boolean closed;

  private RetentionSweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    if (builder.retentionDays < 1) {
      throw new IllegalArgumentException("retentionDays must be >= 1");
    }
    this.retentionDays = builder.retentionDays;
    this.zone = builder.zone != null ? builder.zone : ZoneId.systemDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.logger = builder.logger != null
        ? builder.logger : Logger.getLogger(RetentionSweeper.class.getName());
    this.cleanupTime = parseCleanupTime(builder.cleanupTime);
  }

  private LocalTime parseCleanupTime(String value) {
    if (value == null) {
      return DEFAULT_CLEANUP_TIME;
    }
    try {
      return DailySchedule.parse(value);
    } catch (DateTimeParseException e) {
      logger.log(Level.WARNING, "Invalid cleanup time ''{0}''; using {1}",
          new Object[]{value, DEFAULT_CLEANUP_TIME});
      return DEFAULT_CLEANUP_TIME;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules the first run. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the sweeper has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionSweeper has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("opsaudit-retention-", logger));
    scheduleAfter(ZonedDateTime.now(clock.withZone(zone)));
  }

  private void scheduleAfter(ZonedDateTime after) {
    if (closed) {
      return;
    }
    ZonedDateTime next = DailySchedule.nextRun(after, cleanupTime);
    long delayMs = Math.max(0L, Duration.between(clock.instant(), next.toInstant()).toMillis());
    try {
      nextTask = scheduler.schedule(() -> fire(next), delayMs, TimeUnit.MILLISECONDS);
      nextRunAt = next;
      logger.log(Level.INFO, "Next audit retention sweep at {0}", next);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Retention sweeper closed; not rescheduling", e);
    }
  }

  private void fire(ZonedDateTime scheduledFor) {
    try {
      runOnce();
    } finally {
      ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
      scheduleAfter(now.isAfter(scheduledFor) ? now : scheduledFor);
    }
  }

  /**
   * Deletes every interaction created more than the retention period ago, in one transaction.
   * The period counts calendar days in the sweeper's zone, so it spans 23 or 25 hours of
   * elapsed time on days with a daylight-saving change.
   *
   * <p>May be invoked directly for one-off sweeps.
   *
   * @return the number of interactions removed, or {@code -1} if the sweep failed
   */
  public int runOnce() {
    Instant cutoff = ZonedDateTime.now(clock.withZone(zone)).minusDays(retentionDays).toInstant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      int removed;
      try {
        removed = purger.purge(conn, cutoff);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
      metrics.incrementSweepCompleted(removed);
      logger.log(Level.INFO, "Audit retention sweep removed {0} interactions created before {1}",
          new Object[]{removed, cutoff});
      return removed;
    } catch (SQLException | RuntimeException e) {
      metrics.incrementSweepFailed();
      logger.log(Level.SEVERE, "Audit retention sweep failed (cutoff " + cutoff + ")", e);
      return -1;
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  /** Wall-clock time of the next scheduled run, or {@code null} before {@link #start()}. */
  public ZonedDateTime nextRunAt() {
    return nextRunAt;
  }

  public LocalTime cleanupTime() {
    return cleanupTime;
  }

  /** Cancels the schedule and interrupts a run in progress. */
  @Override
  public void close() {
    ScheduledExecutorService toStop;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      toStop = scheduler;
    }
    ScheduledFuture<?> task = nextTask;
    if (task != null) {
      task.cancel(false);
    }
    if (toStop != null) {
      toStop.shutdownNow();
      try {
        toStop.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionSweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private InteractionPurger purger;
    private int retentionDays = 30;
    private String cleanupTime;
    private ZoneId zone;
    private Clock clock;
    private MetricsExporter metrics;
    private Logger logger;

    private Builder() {}

    /**
     * Sets the connection provider for the sweep transaction.
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
     * Sets the purger that performs the deletes.
     *
     * <p><b>Required.</b>
     *
     * @param purger the interaction purger
     * @return this builder
     */
    public Builder purger(InteractionPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets how many days interactions are kept.
     *
     * <p>Optional. Defaults to {@code 30}. Must be &ge; 1.
     *
     * @param retentionDays days to keep
     * @return this builder
     */
    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    /**
     * Sets the daily time of the sweep as {@code HH:MM}.
     *
     * <p>Optional. Defaults to {@code 03:00}, which is also used when the value cannot be parsed.
     *
     * @param cleanupTime time of day
     * @return this builder
     */
    public Builder cleanupTime(String cleanupTime) {
      this.cleanupTime = cleanupTime;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    public RetentionSweeper build() {
      return new RetentionSweeper(this);
    }
  }
}
