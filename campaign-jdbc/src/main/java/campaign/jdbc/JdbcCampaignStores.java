package campaign.jdbc;

import campaign.jdbc.dialect.Dialects;
import campaign.jdbc.spi.Dialect;
import campaign.jdbc.store.JdbcActionQueueStore;
import campaign.jdbc.store.JdbcCampaignCatalogStore;
import campaign.jdbc.store.JdbcCampaignInstanceStore;
import campaign.jdbc.store.JdbcInboundMessageStore;
import campaign.jdbc.store.JdbcMessageEventStore;
import campaign.jdbc.store.JdbcOutboundMessageStore;
import campaign.jdbc.store.JdbcRateLimitStore;
import campaign.jdbc.store.JdbcStepInstanceStore;
import campaign.jdbc.store.JdbcSuppressionStore;
import campaign.jdbc.store.JdbcTransitionStore;
import campaign.jdbc.store.JdbcWebhookDeliveryStore;
import campaign.spi.ActionQueueStore;
import campaign.spi.CampaignCatalogStore;
import campaign.spi.CampaignInstanceStore;
import campaign.spi.CampaignStores;
import campaign.spi.InboundMessageStore;
import campaign.spi.MessageEventStore;
import campaign.spi.OutboundMessageStore;
import campaign.spi.RateLimitStore;
import campaign.spi.StepInstanceStore;
import campaign.spi.SuppressionStore;
import campaign.spi.TransitionStore;
import campaign.spi.WebhookDeliveryStore;
import campaign.util.JsonCodec;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * JDBC implementation of every campaign store, bound to one {@link Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CampaignStores stores = JdbcCampaignStores.detect(dataSource);
 * CampaignStores stores = JdbcCampaignStores.forDialect("postgresql");
 * }</pre>
 *
 * <p>Schemas for each built-in dialect ship as {@code schema/<dialect>.sql} on the classpath.
 */
public final class JdbcCampaignStores implements CampaignStores {

  private final Dialect dialect;
  private final ActionQueueStore actions;
  private final StepInstanceStore steps;
  private final CampaignInstanceStore instances;
  private final CampaignCatalogStore catalog;
  private final OutboundMessageStore messages;
  private final MessageEventStore events;
  private final InboundMessageStore inbound;
  private final TransitionStore transitions;
  private final SuppressionStore suppressions;
  private final RateLimitStore rateLimits;
  private final WebhookDeliveryStore webhooks;

  public JdbcCampaignStores(Dialect dialect) {
    this(dialect, JsonCodec.getDefault());
  }

  public JdbcCampaignStores(Dialect dialect, JsonCodec jsonCodec) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.actions = new JdbcActionQueueStore(dialect, jsonCodec);
    this.steps = new JdbcStepInstanceStore(dialect, jsonCodec);
    this.instances = new JdbcCampaignInstanceStore(dialect, jsonCodec);
    this.catalog = new JdbcCampaignCatalogStore(dialect, jsonCodec);
    this.messages = new JdbcOutboundMessageStore(dialect, jsonCodec);
    this.events = new JdbcMessageEventStore(dialect, jsonCodec);
    this.inbound = new JdbcInboundMessageStore(dialect, jsonCodec);
    this.transitions = new JdbcTransitionStore(dialect, jsonCodec);
    this.suppressions = new JdbcSuppressionStore(dialect, jsonCodec);
    this.rateLimits = new JdbcRateLimitStore(dialect, jsonCodec);
    this.webhooks = new JdbcWebhookDeliveryStore(dialect, jsonCodec);
  }

  /**
   * Creates stores for the dialect detected from the data source's JDBC URL.
   *
   * @throws IllegalStateException if detection fails
   */
  public static JdbcCampaignStores detect(DataSource dataSource) {
    return new JdbcCampaignStores(Dialects.detect(dataSource));
  }

  /**
   * @param dialectName registered dialect name (case-insensitive)
   * @throws IllegalArgumentException if the dialect is unknown
   */
  public static JdbcCampaignStores forDialect(String dialectName) {
    return new JdbcCampaignStores(Dialects.get(dialectName));
  }

  /** Classpath location of the schema script for this dialect. */
  public String schemaLocation() {
    return "schema/" + dialect.name() + ".sql";
  }

  public Dialect dialect() {
    return dialect;
  }

  @Override
  public ActionQueueStore actions() {
    return actions;
  }

  @Override
  public StepInstanceStore steps() {
    return steps;
  }

  @Override
  public CampaignInstanceStore instances() {
    return instances;
  }

  @Override
  public CampaignCatalogStore catalog() {
    return catalog;
  }

  @Override
  public OutboundMessageStore messages() {
    return messages;
  }

  @Override
  public MessageEventStore events() {
    return events;
  }

  @Override
  public InboundMessageStore inbound() {
    return inbound;
  }

  @Override
  public TransitionStore transitions() {
    return transitions;
  }

  @Override
  public SuppressionStore suppressions() {
    return suppressions;
  }

  @Override
  public RateLimitStore rateLimits() {
    return rateLimits;
  }

  @Override
  public WebhookDeliveryStore webhooks() {
    return webhooks;
  }
}
