package campaign.spi;

/**
 * The full set of stores the engine runs against, usually backed by one database.
 *
 * @see campaign.jdbc.JdbcCampaignStores
 */
public interface CampaignStores {

  ActionQueueStore actions();

  StepInstanceStore steps();

  CampaignInstanceStore instances();

  CampaignCatalogStore catalog();

  OutboundMessageStore messages();

  MessageEventStore events();

  InboundMessageStore inbound();

  TransitionStore transitions();

  SuppressionStore suppressions();

  RateLimitStore rateLimits();

  WebhookDeliveryStore webhooks();
}
