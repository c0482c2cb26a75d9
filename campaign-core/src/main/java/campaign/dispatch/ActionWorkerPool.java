package campaign.dispatch;

import campaign.DispatchResult;
import campaign.model.ScheduledAction;
import campaign.queue.ActionHandler;
import campaign.spi.MetricsExporter;
import campaign.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed pool of daemon worker threads that run claimed actions through a
 * {@link MessageDispatcher}.
 *
 * <p>Actions wait in a bounded in-memory queue. {@link #availableCapacity()} reports its
 * free slots so the poller never claims more than the pool can hold. An action left in
 * the queue at shutdown keeps its lease and is reclaimed by the next sweep.
 */
public final class ActionWorkerPool implements ActionHandler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ActionWorkerPool.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final MessageDispatcher dispatcher;
  private final BlockingQueue<ScheduledAction> queue;
  private final ExecutorService workers;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private ActionWorkerPool(Builder builder) {
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("campaign-worker-"));
    for (int i = 0; i < builder.workerCount; i++) {
      workers.submit(this::workerLoop);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean handle(ScheduledAction action) {
    if (!accepting.get()) {
      return false;
    }
    boolean accepted = queue.offer(action);
    metrics.recordWorkQueueDepth(queue.size());
    return accepted;
  }

  @Override
  public int availableCapacity() {
    return accepting.get() ? queue.remainingCapacity() : 0;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        ScheduledAction action = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (action == null) {
          continue;
        }
        DispatchResult result = dispatcher.dispatch(action);
        logger.log(Level.FINE, "Action {0} -> {1}", new Object[]{action.id(), result});
        metrics.recordWorkQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Worker loop error", t);
      }
    }
  }

  /**
   * Stops accepting work and lets workers drain the queue for up to
   * {@code drainTimeoutMs}, then interrupts them.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with "
            + queue.size() + " action(s) still queued");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link ActionWorkerPool}.
   */
  public static final class Builder {
    private MessageDispatcher dispatcher;
    private int workerCount = 4;
    private int queueCapacity = 100;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder dispatcher(MessageDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 4}. Must be &gt;= 1.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Capacity of the in-memory work queue.
     *
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Time {@link #close()} waits for queued actions to finish.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ActionWorkerPool build() {
      return new ActionWorkerPool(this);
    }
  }
}
