package opsaudit;

/**
 * Ingestion interface handed to request handlers.
 *
 * <p>{@link #submit} is the only call a request path makes: it never blocks and never throws.
 * {@link #close} is invoked once at process termination and waits for queued records to be
 * flushed. When auditing is disabled or the store is unavailable the pipeline is
 * {@link #NOOP}, so callers never need a null check.
 *
 * @see AuditPipelines
 */
public interface AuditPipeline extends AutoCloseable {

  /** Pipeline that accepts and discards everything. */
  AuditPipeline NOOP = new Noop();

  /**
   * Hands a completed interaction over for asynchronous persistence. Records that cannot be
   * queued are dropped and counted.
   *
   * @param record the interaction; {@code null} is ignored
   */
  void submit(InteractionRecord record);

  /**
   * Whether submitted records are actually persisted.
   *
   * @return {@code false} for the no-op pipeline
   */
  boolean isEnabled();

  /**
   * Stops accepting records, flushes everything already queued and releases the store.
   * Idempotent.
   */
  @Override
  void close();

  /** Null-object pipeline. */
  final class Noop implements AuditPipeline {
    private Noop() {
    }

    @Override
    public void submit(InteractionRecord record) {
    }

    @Override
    public boolean isEnabled() {
      return false;
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
      return "AuditPipeline.NOOP";
    }
  }
}
