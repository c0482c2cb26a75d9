package campaign.spring.boot;

import campaign.CampaignEngine;
import campaign.dispatch.ExponentialBackoffRetryPolicy;
import campaign.dispatch.RetryPolicy;
import campaign.ingest.EventIngestor;
import campaign.ingest.SendGridSignatureVerifier;
import campaign.ingest.WebhookNormalizer;
import campaign.ingest.WebhookSignatureVerifier;
import campaign.jdbc.DataSourceConnectionProvider;
import campaign.jdbc.JdbcCampaignStores;
import campaign.lifecycle.CampaignInstanceManager;
import campaign.schedule.CampaignCatalog;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.spi.MessageProvider;
import campaign.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the campaign engine.
 *
 * <p>Wires a {@link CampaignEngine} from the application's {@link DataSource}, every
 * {@link MessageProvider} bean (bound to channels by {@link CampaignProvider} where
 * annotated) and {@link CampaignProperties}. The engine starts polling
 * once built unless {@code campaign.poller.enabled=false}.
 *
 * @see CampaignProperties
 * @see CampaignMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CampaignEngine.class)
@ConditionalOnBean({DataSource.class, MessageProvider.class})
@EnableConfigurationProperties(CampaignProperties.class)
public class CampaignAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(CampaignStores.class)
  public JdbcCampaignStores campaignStores(DataSource dataSource) {
    return JdbcCampaignStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider campaignConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(RetryPolicy.class)
  public ExponentialBackoffRetryPolicy campaignRetryPolicy(CampaignProperties props) {
    return new ExponentialBackoffRetryPolicy(props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs());
  }

  @Bean
  @ConditionalOnProperty(prefix = "campaign.sendgrid", name = "public-key")
  @ConditionalOnMissingBean(SendGridSignatureVerifier.class)
  public SendGridSignatureVerifier sendGridSignatureVerifier(CampaignProperties props) {
    return new SendGridSignatureVerifier(props.getSendgrid().getPublicKey(),
        props.getSendgrid().getMaxTimestampAge(), Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public CampaignProviderRegistrar campaignProviderRegistrar(ListableBeanFactory beanFactory) {
    return new CampaignProviderRegistrar(beanFactory);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CampaignEngine campaignEngine(CampaignProperties props,
      ConnectionProvider connectionProvider,
      CampaignStores campaignStores,
      RetryPolicy retryPolicy,
      CampaignProviderRegistrar providerRegistrar,
      ObjectProvider<WebhookNormalizer> normalizers,
      ObjectProvider<WebhookSignatureVerifier> verifiers,
      ObjectProvider<MetricsExporter> metricsProvider) {

    CampaignEngine.Builder builder = CampaignEngine.builder()
        .connectionProvider(connectionProvider)
        .stores(campaignStores)
        .providers(providerRegistrar.providers())
        .leaseDuration(props.getPoller().getLease())
        .retryPolicy(retryPolicy)
        .maxAttempts(props.getDispatcher().getMaxAttempts())
        .rateLimitBackoff(props.getDispatcher().getRateLimitBackoff())
        .workerCount(props.getDispatcher().getWorkerCount())
        .queueCapacity(props.getDispatcher().getQueueCapacity())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
        .intervalMs(props.getPoller().getIntervalMs())
        .batchSize(props.getPoller().getBatchSize())
        .replyPolicy(props.getReplyPolicy())
        .tenantId(props.getPoller().getTenantId());
    String ownerId = props.getPoller().getOwnerId();
    if (ownerId != null && !ownerId.isEmpty()) {
      builder.ownerId(ownerId);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    List<WebhookNormalizer> extraNormalizers = normalizers.orderedStream().toList();
    extraNormalizers.forEach(builder::normalizer);
    verifiers.orderedStream().forEach(builder::verifier);

    CampaignEngine engine = builder.build();
    if (props.getPoller().isEnabled()) {
      engine.start();
    }
    return engine;
  }

  @Bean
  @ConditionalOnMissingBean
  public CampaignCatalog campaignCatalog(CampaignEngine engine) {
    return engine.catalog();
  }

  @Bean
  @ConditionalOnMissingBean
  public CampaignInstanceManager campaignInstanceManager(CampaignEngine engine) {
    return engine.instances();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventIngestor campaignEventIngestor(CampaignEngine engine) {
    return engine.ingestor();
  }
}
