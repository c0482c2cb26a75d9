package campaign;

import campaign.dispatch.ActionWorkerPool;
import campaign.dispatch.ChannelProviders;
import campaign.dispatch.MessageDispatcher;
import campaign.dispatch.RetryPolicy;
import campaign.gate.RateLimiter;
import campaign.gate.SuppressionGate;
import campaign.ingest.EventIngestor;
import campaign.ingest.InboundReplyNormalizer;
import campaign.ingest.SendGridWebhookNormalizer;
import campaign.ingest.TransitionEngine;
import campaign.ingest.WebhookNormalizer;
import campaign.ingest.WebhookSignatureVerifier;
import campaign.lifecycle.CampaignInstanceManager;
import campaign.model.ReplyPolicy;
import campaign.queue.ActionPoller;
import campaign.queue.ActionQueue;
import campaign.schedule.CampaignCatalog;
import campaign.schedule.SendTimeCalculator;
import campaign.schedule.StepScheduler;
import campaign.schedule.TemplateRenderer;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.spi.MessageProvider;
import campaign.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The campaign engine wired together: catalog, scheduler, queue, gates, dispatcher,
 * webhook ingestion and the polling loop.
 *
 * <p>Nothing runs in the background until {@link #start()}. {@link #close()} stops the
 * poller, drains the worker pool, then closes the metrics exporter if it is
 * {@link AutoCloseable}.
 *
 * <pre>{@code
 * CampaignEngine engine = CampaignEngine.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .stores(JdbcCampaignStores.detect(dataSource))
 *     .provider(emailProvider)
 *     .leaseDuration(Duration.ofMinutes(5))
 *     .build();
 * engine.start();
 * }</pre>
 */
public final class CampaignEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignEngine.class.getName());

  private final CampaignCatalog catalog;
  private final StepScheduler scheduler;
  private final CampaignInstanceManager instances;
  private final ActionQueue queue;
  private final SuppressionGate suppressions;
  private final RateLimiter rateLimiter;
  private final MessageDispatcher dispatcher;
  private final TransitionEngine transitions;
  private final EventIngestor ingestor;
  private final ActionWorkerPool workerPool;
  private final ActionPoller poller;
  private final MetricsExporter metrics;

  private CampaignEngine(Builder builder) {
    ConnectionProvider cp = builder.connectionProvider;
    CampaignStores stores = builder.stores;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    this.catalog = new CampaignCatalog(cp, stores.catalog(), clock);
    this.queue = new ActionQueue(cp, stores.actions(), stores.steps(), clock, builder.leaseDuration,
        builder.ownerId);
    this.scheduler = new StepScheduler(cp, stores, queue, new SendTimeCalculator(), new TemplateRenderer(), clock);
    this.instances = new CampaignInstanceManager(cp, stores, queue, scheduler, clock);
    this.suppressions = new SuppressionGate(cp, stores.suppressions(), clock);
    this.rateLimiter = new RateLimiter(cp, stores.rateLimits(), clock);

    MessageDispatcher.Builder db = MessageDispatcher.builder()
        .connectionProvider(cp)
        .stores(stores)
        .queue(queue)
        .scheduler(scheduler)
        .suppressionGate(suppressions)
        .rateLimiter(rateLimiter)
        .providers(ChannelProviders.of(builder.providers))
        .maxAttempts(builder.maxAttempts)
        .rateLimitBackoff(builder.rateLimitBackoff)
        .clock(clock)
        .metrics(metrics);
    if (builder.retryPolicy != null) {
      db.retryPolicy(builder.retryPolicy);
    }
    this.dispatcher = db.build();

    this.transitions = new TransitionEngine(cp, stores, scheduler, instances, suppressions, builder.replyPolicy,
        clock, metrics);
    List<WebhookNormalizer> normalizers = new ArrayList<>();
    normalizers.add(new SendGridWebhookNormalizer());
    normalizers.add(new InboundReplyNormalizer());
    normalizers.addAll(builder.normalizers);
    this.ingestor = new EventIngestor(cp, stores.webhooks(), transitions, normalizers, builder.verifiers, clock);

    this.workerPool = ActionWorkerPool.builder()
        .dispatcher(dispatcher)
        .workerCount(builder.workerCount)
        .queueCapacity(builder.queueCapacity)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .metrics(metrics)
        .build();
    this.poller = ActionPoller.builder()
        .queue(queue)
        .handler(workerPool)
        .batchSize(builder.batchSize)
        .intervalMs(builder.intervalMs)
        .tenantId(builder.tenantId)
        .clock(clock)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the polling loop. Calling it again has no effect.
   */
  public void start() {
    poller.start();
    logger.log(Level.INFO, "Campaign engine started as {0}", queue.ownerId());
  }

  public CampaignCatalog catalog() {
    return catalog;
  }

  public StepScheduler scheduler() {
    return scheduler;
  }

  public CampaignInstanceManager instances() {
    return instances;
  }

  public ActionQueue queue() {
    return queue;
  }

  public SuppressionGate suppressions() {
    return suppressions;
  }

  public RateLimiter rateLimiter() {
    return rateLimiter;
  }

  public MessageDispatcher dispatcher() {
    return dispatcher;
  }

  public TransitionEngine transitions() {
    return transitions;
  }

  public EventIngestor ingestor() {
    return ingestor;
  }

  public ActionPoller poller() {
    return poller;
  }

  @Override
  public void close() {
    RuntimeException first = null;
    try {
      poller.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      workerPool.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link CampaignEngine}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStores stores;
    private final List<MessageProvider> providers = new ArrayList<>();
    private final List<WebhookNormalizer> normalizers = new ArrayList<>();
    private final List<WebhookSignatureVerifier> verifiers = new ArrayList<>();
    private Duration leaseDuration;
    private String ownerId;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private Duration rateLimitBackoff = Duration.ofSeconds(30);
    private int batchSize = 50;
    private long intervalMs = 1000;
    private int workerCount = 4;
    private int queueCapacity = 100;
    private long drainTimeoutMs = 5000;
    private ReplyPolicy replyPolicy = ReplyPolicy.STOP;
    private String tenantId;
    private MetricsExporter metrics;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <p><b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder stores(CampaignStores stores) {
      this.stores = stores;
      return this;
    }

    /**
     * Registers the provider for one channel. At least one is required.
     */
    public Builder provider(MessageProvider provider) {
      this.providers.add(Objects.requireNonNull(provider, "provider"));
      return this;
    }

    public Builder providers(List<? extends MessageProvider> providers) {
      providers.forEach(this::provider);
      return this;
    }

    /**
     * How long a claimed action stays owned by this process before other workers may
     * reclaim it. Must comfortably exceed the slowest provider call.
     *
     * <p><b>Required.</b> There is no default.
     */
    public Builder leaseDuration(Duration leaseDuration) {
      this.leaseDuration = leaseDuration;
      return this;
    }

    /**
     * <p>Optional. Defaults to a random {@code worker-xxxxxxxx} id.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** <p>Optional. Defaults to {@code 5}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** <p>Optional. Defaults to 30 seconds. */
    public Builder rateLimitBackoff(Duration rateLimitBackoff) {
      this.rateLimitBackoff = rateLimitBackoff;
      return this;
    }

    /** <p>Optional. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** <p>Optional. Defaults to {@code 1000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** <p>Optional. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** <p>Optional. Defaults to {@code 100}. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /** <p>Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * What an inbound reply does to the contact's instance.
     *
     * <p>Optional. Defaults to {@link ReplyPolicy#STOP}.
     */
    public Builder replyPolicy(ReplyPolicy replyPolicy) {
      this.replyPolicy = Objects.requireNonNull(replyPolicy, "replyPolicy");
      return this;
    }

    /**
     * Restricts this engine's poller to one tenant.
     *
     * <p>Optional. Defaults to all tenants.
     */
    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    /**
     * Adds a normalizer for a provider beyond the built-in SendGrid and inbound reply ones.
     */
    public Builder normalizer(WebhookNormalizer normalizer) {
      this.normalizers.add(Objects.requireNonNull(normalizer, "normalizer"));
      return this;
    }

    public Builder verifier(WebhookSignatureVerifier verifier) {
      this.verifiers.add(Objects.requireNonNull(verifier, "verifier"));
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** <p>Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public CampaignEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(stores, "stores");
      Objects.requireNonNull(leaseDuration, "leaseDuration");
      if (providers.isEmpty()) {
        throw new IllegalArgumentException("At least one MessageProvider is required");
      }
      return new CampaignEngine(this);
    }
  }
}
