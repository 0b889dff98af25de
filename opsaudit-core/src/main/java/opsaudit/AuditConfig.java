package opsaudit;

import java.time.Duration;
import java.time.ZoneId;

public final class AuditConfig {
  private boolean enabled;

  private int workers = 2;
  private int queueSize = 1000;
  private int batchSize = 10;
  private Duration batchInterval = Duration.ofSeconds(5);
  private Duration drainTimeout = Duration.ofSeconds(30);

  private final Retention retention = new Retention();

  public boolean isEnabled() {
    return enabled;
  }

  public AuditConfig setEnabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public int getWorkers() {
    return workers;
  }

  public AuditConfig setWorkers(int workers) {
    this.workers = workers;
    return this;
  }

  public int getQueueSize() {
    return queueSize;
  }

  public AuditConfig setQueueSize(int queueSize) {
    this.queueSize = queueSize;
    return this;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public AuditConfig setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  public Duration getBatchInterval() {
    return batchInterval;
  }

  public AuditConfig setBatchInterval(Duration batchInterval) {
    this.batchInterval = batchInterval;
    return this;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public AuditConfig setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
    return this;
  }

  public Retention getRetention() {
    return retention;
  }

  /**
   * Checks every value against its allowed range.
   *
   * @throws IllegalArgumentException naming the first invalid option
   */
  public void validate() {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1");
    }
    if (queueSize < 1) {
      throw new IllegalArgumentException("queueSize must be >= 1");
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    requirePositive(batchInterval, "batchInterval");
    requirePositive(drainTimeout, "drainTimeout");
    if (retention.days < 0) {
      throw new IllegalArgumentException("retention days must be >= 0");
    }
    if (retention.zone == null) {
      throw new IllegalArgumentException("retention zone must be set");
    }
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  @Override
  public String toString() {
    return "AuditConfig{enabled=" + enabled
        + ", workers=" + workers
        + ", queueSize=" + queueSize
        + ", batchSize=" + batchSize
        + ", batchInterval=" + batchInterval
        + ", drainTimeout=" + drainTimeout
        + ", retention=" + retention
        + '}';
  }

  /** Retention settings for the daily sweep. */
  public static final class Retention {
    private int days = 30;
    private boolean autoCleanup;
    private String cleanupTime = "03:00";
    private ZoneId zone = ZoneId.systemDefault();

    public int getDays() {
      return days;
    }

    /** Days to keep interactions; {@code 0} keeps them forever. */
    public Retention setDays(int days) {
      this.days = days;
      return this;
    }

    public boolean isAutoCleanup() {
      return autoCleanup;
    }

    public Retention setAutoCleanup(boolean autoCleanup) {
      this.autoCleanup = autoCleanup;
      return this;
    }

    public String getCleanupTime() {
      return cleanupTime;
    }

    /** Local time of day of the sweep, {@code HH:MM}. */
    public Retention setCleanupTime(String cleanupTime) {
      this.cleanupTime = cleanupTime;
      return this;
    }

    public ZoneId getZone() {
      return zone;
    }

    public Retention setZone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /** Whether a sweeper should run at all. */
    public boolean isActive() {
      return autoCleanup && days > 0;
    }

    @Override
    public String toString() {
      return "Retention{days=" + days
          + ", autoCleanup=" + autoCleanup
          + ", cleanupTime=" + cleanupTime
          + ", zone=" + zone
          + '}';
    }
  }
}
