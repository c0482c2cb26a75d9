package campaign.spring.boot;

import campaign.CampaignEngine;
import campaign.DispatchResult;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.model.CampaignPlanVersion;
import campaign.model.Channel;
import campaign.model.Enrollment;
import campaign.model.ScheduledAction;
import campaign.schedule.StepDefinition;
import campaign.spi.MessageProvider;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CampaignProviderRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          CampaignAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:campaign_provider_test;MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "campaign.poller.enabled=false");

  @Test
  void unannotatedProviderServesItsOwnChannel() {
    runner.withUserConfiguration(EmailConfig.class).run(ctx -> {
      List<MessageProvider> providers = ctx.getBean(CampaignProviderRegistrar.class).providers();
      assertEquals(1, providers.size());
      assertSame(ctx.getBean(EmailProvider.class), providers.get(0));
    });
  }

  @Test
  void annotatedProviderServesListedChannels() {
    runner.withUserConfiguration(EmailConfig.class, GatewayConfig.class).run(ctx -> {
      List<MessageProvider> providers = ctx.getBean(CampaignProviderRegistrar.class).providers();
      assertEquals(List.of(Channel.EMAIL, Channel.SMS, Channel.CALL),
          providers.stream().map(MessageProvider::channel).toList());
      assertSame(ctx.getBean(SmsAndCallGateway.class), providers.get(1));
    });
  }

  @Test
  void engineDispatchesThroughBoundChannel() {
    runner.withUserConfiguration(GatewayConfig.class).run(ctx -> {
      CampaignEngine engine = ctx.getBean(CampaignEngine.class);
      String templateId = engine.catalog().createTemplate("acme", "Call list").id();
      engine.catalog().addStep("acme", templateId, StepDefinition.of(1, Channel.CALL, Duration.ZERO, Map.of()));
      CampaignPlanVersion plan = engine.catalog().publish("acme", templateId);
      engine.scheduler().materializeInstance(Enrollment.builder("acme", "contact-1")
          .address(Channel.CALL, "+15550100000")
          .build(), plan);

      List<ScheduledAction> claimed = engine.queue().claimDue("acme", 10);
      assertEquals(1, claimed.size());
      assertInstanceOf(DispatchResult.Sent.class, engine.dispatcher().dispatch(claimed.get(0)));

      List<SendRequest> requests = ctx.getBean(SmsAndCallGateway.class).requests;
      assertEquals(1, requests.size());
      assertEquals(Channel.CALL, requests.get(0).channel());
    });
  }

  @Test
  void failsWhenAnnotatedBeanIsNotAProvider() {
    runner.withUserConfiguration(EmailConfig.class, NotAProviderConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertNotNull(findCause(ctx.getStartupFailure(), BeanCreationException.class));
    });
  }

  @Test
  void failsWhenTwoProvidersServeOneChannel() {
    runner.withUserConfiguration(EmailConfig.class, EmailGatewayConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertNotNull(findCause(ctx.getStartupFailure(), IllegalArgumentException.class));
    });
  }

  private static Throwable findCause(Throwable t, Class<? extends Throwable> type) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (type.isInstance(current)) {
        return current;
      }
    }
    return null;
  }

  static class EmailProvider implements MessageProvider {
    @Override
    public Channel channel() {
      return Channel.EMAIL;
    }

    @Override
    public SendReceipt send(SendRequest request) {
      return SendReceipt.accepted("email-" + request.dedupeKey());
    }
  }

  @CampaignProvider(channels = {Channel.SMS, Channel.CALL})
  static class SmsAndCallGateway implements MessageProvider {
    final List<SendRequest> requests = new CopyOnWriteArrayList<>();

    @Override
    public Channel channel() {
      return Channel.SMS;
    }

    @Override
    public SendReceipt send(SendRequest request) {
      requests.add(request);
      return SendReceipt.completed("gw-" + request.dedupeKey());
    }
  }

  @CampaignProvider(channels = Channel.EMAIL)
  static class EmailGateway extends SmsAndCallGateway {
  }

  @CampaignProvider(channels = Channel.SMS)
  static class NotAProvider {
  }

  @Configuration
  static class EmailConfig {
    @Bean
    EmailProvider emailProvider() {
      return new EmailProvider();
    }
  }

  @Configuration
  static class GatewayConfig {
    @Bean
    SmsAndCallGateway smsAndCallGateway() {
      return new SmsAndCallGateway();
    }
  }

  @Configuration
  static class EmailGatewayConfig {
    @Bean
    EmailGateway emailGateway() {
      return new EmailGateway();
    }
  }

  @Configuration
  static class NotAProviderConfig {
    @Bean
    NotAProvider notAProvider() {
      return new NotAProvider();
    }
  }
}
