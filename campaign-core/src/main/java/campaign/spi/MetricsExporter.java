package campaign.spi;

/**
 * Observability hook for the engine's counters and gauges.
 *
 * <p>{@link #NOOP} discards everything. {@code campaign-micrometer} provides a
 * Micrometer-backed implementation.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** Actions claimed by the poller. */
  void incrementClaimed(int count);

  /** Messages accepted by a provider. */
  void incrementSent();

  /** Dispatches short-circuited by an existing dedupe key. */
  void incrementDeduplicated();

  /** Steps skipped by suppression, unsubscribe, validation or branch condition. */
  void incrementSkipped();

  /** Actions returned to pending because a rate limit was exhausted. */
  void incrementDeferred();

  /** Transient failures that will be retried. */
  void incrementRetried();

  /** Actions that ended failed. */
  void incrementFailed();

  /** Actions returned to pending by the lease sweep. */
  default void incrementReclaimed(int count) {
  }

  /** Normalized webhook events applied by the transition engine. */
  default void incrementEventsApplied() {
  }

  /** Number of claimed actions waiting for a worker. */
  void recordWorkQueueDepth(int depth);

  /** Age of the oldest due pending action, in milliseconds. */
  void recordOldestDueLagMs(long lagMs);

  final class Noop implements MetricsExporter {
    @Override
    public void incrementClaimed(int count) {
    }

    @Override
    public void incrementSent() {
    }

    @Override
    public void incrementDeduplicated() {
    }

    @Override
    public void incrementSkipped() {
    }

    @Override
    public void incrementDeferred() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordWorkQueueDepth(int depth) {
    }

    @Override
    public void recordOldestDueLagMs(long lagMs) {
    }
  }
}
