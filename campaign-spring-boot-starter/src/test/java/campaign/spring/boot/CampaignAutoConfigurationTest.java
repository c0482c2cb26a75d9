package campaign.spring.boot;

import campaign.CampaignEngine;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.dispatch.ExponentialBackoffRetryPolicy;
import campaign.dispatch.RetryPolicy;
import campaign.ingest.EventIngestor;
import campaign.ingest.SendGridSignatureVerifier;
import campaign.jdbc.DataSourceConnectionProvider;
import campaign.jdbc.JdbcCampaignStores;
import campaign.lifecycle.CampaignInstanceManager;
import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignTemplate;
import campaign.model.Channel;
import campaign.schedule.CampaignCatalog;
import campaign.schedule.StepDefinition;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.spi.MessageProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.KeyPairGenerator;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CampaignAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          CampaignAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:campaign_auto_test;MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "campaign.poller.enabled=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("campaignStores"));
      assertTrue(ctx.containsBean("campaignConnectionProvider"));
      assertTrue(ctx.containsBean("campaignRetryPolicy"));
      assertTrue(ctx.containsBean("campaignEngine"));

      assertInstanceOf(JdbcCampaignStores.class, ctx.getBean(CampaignStores.class));
      assertEquals("h2", ctx.getBean(JdbcCampaignStores.class).dialect().name());
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(ExponentialBackoffRetryPolicy.class, ctx.getBean(RetryPolicy.class));

      CampaignEngine engine = ctx.getBean(CampaignEngine.class);
      assertSame(engine.catalog(), ctx.getBean(CampaignCatalog.class));
      assertSame(engine.instances(), ctx.getBean(CampaignInstanceManager.class));
      assertSame(engine.ingestor(), ctx.getBean(EventIngestor.class));
      assertFalse(ctx.containsBean("sendGridSignatureVerifier"));
    });
  }

  @Test
  void catalogWorksAgainstInitializedSchema() {
    runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
      CampaignCatalog catalog = ctx.getBean(CampaignCatalog.class);
      CampaignTemplate template = catalog.createTemplate("acme", "Welcome");
      catalog.addStep("acme", template.id(), StepDefinition.of(1, Channel.EMAIL, Duration.ZERO,
          Map.of("subject", "Hi {{first_name}}")));
      CampaignPlanVersion plan = catalog.publish("acme", template.id());
      assertEquals(1, plan.steps().size());
    });
  }

  @Test
  void retryPropertiesReachPolicy() {
    runner.withUserConfiguration(ProviderConfig.class)
        .withPropertyValues("campaign.retry.base-delay-ms=250", "campaign.retry.max-delay-ms=5000")
        .run(ctx -> {
          ExponentialBackoffRetryPolicy policy = ctx.getBean(ExponentialBackoffRetryPolicy.class);
          assertEquals(250, policy.baseDelayMs());
          assertEquals(5000, policy.maxDelayMs());
        });
  }

  @Test
  void ownerIdIsUsedForLeases() {
    runner.withUserConfiguration(ProviderConfig.class)
        .withPropertyValues("campaign.poller.owner-id=node-a")
        .run(ctx -> assertEquals("node-a", ctx.getBean(CampaignEngine.class).queue().ownerId()));
  }

  @Test
  void verifierIsCreatedFromPublicKey() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(256);
    String key = Base64.getEncoder().encodeToString(generator.generateKeyPair().getPublic().getEncoded());

    runner.withUserConfiguration(ProviderConfig.class)
        .withPropertyValues("campaign.sendgrid.public-key=" + key)
        .run(ctx -> assertNotNull(ctx.getBean(SendGridSignatureVerifier.class)));
  }

  @Test
  void invalidPublicKeyFailsStartup() {
    runner.withUserConfiguration(ProviderConfig.class)
        .withPropertyValues("campaign.sendgrid.public-key=not-a-key")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class,
              findCause(ctx.getStartupFailure(), IllegalArgumentException.class));
        });
  }

  @Test
  void backsOffWithoutMessageProviders() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("campaignEngine"));
      assertFalse(ctx.containsBean("campaignStores"));
    });
  }

  @Test
  void userRetryPolicyReplacesDefault() {
    runner.withUserConfiguration(ProviderConfig.class, CustomRetryConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("campaignRetryPolicy"));
      assertSame(CustomRetryConfig.POLICY, ctx.getBean(RetryPolicy.class));
    });
  }

  private static Throwable findCause(Throwable t, Class<? extends Throwable> type) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (type.isInstance(current)) {
        return current;
      }
    }
    return t;
  }

  @Configuration
  static class ProviderConfig {
    @Bean
    MessageProvider emailProvider() {
      return new MessageProvider() {
        @Override
        public Channel channel() {
          return Channel.EMAIL;
        }

        @Override
        public SendReceipt send(SendRequest request) {
          return SendReceipt.accepted("msg-" + request.dedupeKey());
        }
      };
    }
  }

  @Configuration
  static class CustomRetryConfig {
    static final RetryPolicy POLICY = attempt -> 10L;

    @Bean
    RetryPolicy customRetryPolicy() {
      return POLICY;
    }
  }
}
