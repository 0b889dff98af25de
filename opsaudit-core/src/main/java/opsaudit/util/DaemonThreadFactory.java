package opsaudit.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Threads for the audit workers and the retention sweeper: daemon, named
 * {@code <prefix>1}, {@code <prefix>2}, ..., and reporting anything that escapes their task to
 * the owning component's logger instead of stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private final String prefix;
  private final Logger logger;
  private final AtomicInteger nextId = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix, Logger logger) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + nextId.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Audit thread " + t.getName() + " terminated unexpectedly", e));
    return thread;
  }
}
