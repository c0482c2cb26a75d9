package campaign.spring.boot;

import campaign.model.ReplyPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the campaign engine.
 *
 * @see CampaignAutoConfiguration
 */
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

  /**
   * What an inbound reply does to the contact's instance.
   */
  private ReplyPolicy replyPolicy = ReplyPolicy.STOP;

  private final Dispatcher dispatcher = new Dispatcher();
  private final Retry retry = new Retry();
  private final Poller poller = new Poller();
  private final SendGrid sendgrid = new SendGrid();
  private final Metrics metrics = new Metrics();

  public ReplyPolicy getReplyPolicy() {
    return replyPolicy;
  }

  public void setReplyPolicy(ReplyPolicy replyPolicy) {
    this.replyPolicy = replyPolicy;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Retry getRetry() {
    return retry;
  }

  public Poller getPoller() {
    return poller;
  }

  public SendGrid getSendgrid() {
    return sendgrid;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Dispatcher {
    private int workerCount = 4;
    private int queueCapacity = 100;
    private int maxAttempts = 5;
    private long drainTimeoutMs = 5000;
    private Duration rateLimitBackoff = Duration.ofSeconds(30);

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }

    public Duration getRateLimitBackoff() {
      return rateLimitBackoff;
    }

    public void setRateLimitBackoff(Duration rateLimitBackoff) {
      this.rateLimitBackoff = rateLimitBackoff;
    }
  }

  public static class Retry {
    private long baseDelayMs = 1000;
    private long maxDelayMs = 300000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Poller {
    /**
     * Whether the engine starts polling for due actions on startup.
     */
    private boolean enabled = true;
    private long intervalMs = 1000;
    private int batchSize = 50;

    /**
     * Lease owner id of this process. A random id is generated when unset.
     */
    private String ownerId;

    /**
     * How long a claimed action stays owned before other workers may reclaim it.
     */
    private Duration lease = Duration.ofMinutes(5);

    /**
     * Restricts the poller to one tenant. All tenants when unset.
     */
    private String tenantId;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public String getOwnerId() {
      return ownerId;
    }

    public void setOwnerId(String ownerId) {
      this.ownerId = ownerId;
    }

    public Duration getLease() {
      return lease;
    }

    public void setLease(Duration lease) {
      this.lease = lease;
    }

    public String getTenantId() {
      return tenantId;
    }

    public void setTenantId(String tenantId) {
      this.tenantId = tenantId;
    }
  }

  public static class SendGrid {
    /**
     * Event Webhook verification key. Signed webhooks are not checked when unset.
     */
    private String publicKey;
    private Duration maxTimestampAge = Duration.ofMinutes(10);

    public String getPublicKey() {
      return publicKey;
    }

    public void setPublicKey(String publicKey) {
      this.publicKey = publicKey;
    }

    public Duration getMaxTimestampAge() {
      return maxTimestampAge;
    }

    public void setMaxTimestampAge(Duration maxTimestampAge) {
      this.maxTimestampAge = maxTimestampAge;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "campaign";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
