package campaign.micrometer;

import campaign.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code campaign.actions.claimed} - actions claimed by the poller</li>
 *   <li>{@code campaign.actions.reclaimed} - expired leases returned to pending</li>
 *   <li>{@code campaign.dispatch.sent} - messages accepted by a provider</li>
 *   <li>{@code campaign.dispatch.deduplicated} - sends short-circuited by a dedupe key</li>
 *   <li>{@code campaign.dispatch.skipped} - steps skipped by a gate or branch condition</li>
 *   <li>{@code campaign.dispatch.deferred} - actions deferred by a rate limit</li>
 *   <li>{@code campaign.dispatch.retried} - transient failures scheduled for retry</li>
 *   <li>{@code campaign.dispatch.failed} - actions that ended failed</li>
 *   <li>{@code campaign.events.applied} - webhook events applied to messages and steps</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code campaign.queue.work.depth} - claimed actions waiting for a worker</li>
 *   <li>{@code campaign.lag.oldest.ms} - age of the oldest due pending action</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter claimed;
  private final Counter reclaimed;
  private final Counter sent;
  private final Counter deduplicated;
  private final Counter skipped;
  private final Counter deferred;
  private final Counter retried;
  private final Counter failed;
  private final Counter eventsApplied;
  private final List<Meter> meters = new ArrayList<>();

  private final AtomicInteger workQueueDepth = new AtomicInteger();
  private final AtomicLong oldestDueLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "campaign"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "campaign");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "sales.campaign"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    this.claimed = counter(namePrefix + ".actions.claimed", "Actions claimed by the poller");
    this.reclaimed = counter(namePrefix + ".actions.reclaimed", "Expired leases returned to pending");
    this.sent = counter(namePrefix + ".dispatch.sent", "Messages accepted by a provider");
    this.deduplicated = counter(namePrefix + ".dispatch.deduplicated", "Sends short-circuited by a dedupe key");
    this.skipped = counter(namePrefix + ".dispatch.skipped", "Steps skipped by a gate or branch condition");
    this.deferred = counter(namePrefix + ".dispatch.deferred", "Actions deferred by a rate limit");
    this.retried = counter(namePrefix + ".dispatch.retried", "Transient failures scheduled for retry");
    this.failed = counter(namePrefix + ".dispatch.failed", "Actions that ended failed");
    this.eventsApplied = counter(namePrefix + ".events.applied", "Webhook events applied");

    meters.add(Gauge.builder(namePrefix + ".queue.work.depth", workQueueDepth, AtomicInteger::get)
        .description("Claimed actions waiting for a worker")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".lag.oldest.ms", oldestDueLagMs, AtomicLong::get)
        .description("Age of the oldest due pending action")
        .register(registry));
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(name).description(description).register(registry);
    meters.add(counter);
    return counter;
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed) return;
    claimed.increment(count);
  }

  @Override
  public void incrementReclaimed(int count) {
    if (closed) return;
    reclaimed.increment(count);
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementDeduplicated() {
    if (closed) return;
    deduplicated.increment();
  }

  @Override
  public void incrementSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementDeferred() {
    if (closed) return;
    deferred.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementEventsApplied() {
    if (closed) return;
    eventsApplied.increment();
  }

  @Override
  public void recordWorkQueueDepth(int depth) {
    if (closed) return;
    workQueueDepth.set(depth);
  }

  @Override
  public void recordOldestDueLagMs(long lagMs) {
    if (closed) return;
    oldestDueLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
