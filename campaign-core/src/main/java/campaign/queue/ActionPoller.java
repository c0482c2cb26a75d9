package campaign.queue;

import campaign.model.ScheduledAction;
import campaign.spi.MetricsExporter;
import campaign.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled loop that feeds claimed actions to an {@link ActionHandler}.
 *
 * <p>Each cycle sweeps expired leases, then claims at most
 * {@code min(batchSize, handler.availableCapacity())} due actions and hands them over.
 * Several pollers, in one process or many, may share the same database.
 *
 * <p>The {@link #start()} and {@link #close()} methods are synchronized.
 */
public final class ActionPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ActionPoller.class.getName());

  private final ActionQueue queue;
  private final ActionHandler handler;
  private final int batchSize;
  private final long intervalMs;
  private final String tenantId;
  private final Clock clock;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private ActionPoller(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.tenantId = builder.tenantId;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the polling schedule. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ActionPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("campaign-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one poll cycle. Called by the schedule; tests may call it directly.
   *
   * @return number of actions handed to the handler
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = clock.instant();
      int reclaimed = queue.reclaimExpired(now);
      if (reclaimed > 0) {
        metrics.incrementReclaimed(reclaimed);
      }

      int capacity = handler.availableCapacity();
      if (capacity <= 0) {
        return 0;
      }
      List<ScheduledAction> claimed = queue.claimDue(tenantId, now, Math.min(batchSize, capacity));
      if (!claimed.isEmpty()) {
        metrics.incrementClaimed(claimed.size());
      }
      int handed = 0;
      for (ScheduledAction action : claimed) {
        if (handler.handle(action)) {
          handed++;
        } else {
          queue.release(action, action.scheduledAt(), "worker queue full", false);
        }
      }
      recordLag(now);
      return handed;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed", t);
      return 0;
    }
  }

  private void recordLag(Instant now) {
    Optional<Instant> oldest = queue.oldestDue(now);
    long lagMs = oldest.map(at -> Math.max(0L, Duration.between(at, now).toMillis())).orElse(0L);
    metrics.recordOldestDueLagMs(lagMs);
  }

  /**
   * Cancels the polling schedule and stops the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link ActionPoller}.
   */
  public static final class Builder {
    private ActionQueue queue;
    private ActionHandler handler;
    private int batchSize = 50;
    private long intervalMs = 1000;
    private String tenantId;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder queue(ActionQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the receiver of claimed actions, typically an
     * {@link campaign.dispatch.ActionWorkerPool}.
     *
     * <p><b>Required.</b>
     */
    public Builder handler(ActionHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Maximum actions claimed per cycle.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Delay between the end of one cycle and the start of the next.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Restricts claiming to one tenant.
     *
     * <p>Optional. Defaults to all tenants.
     */
    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ActionPoller build() {
      return new ActionPoller(this);
    }
  }
}
