package campaign.jdbc;

import campaign.CampaignEngine;
import campaign.DispatchResult;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.model.CampaignPlanVersion;
import campaign.model.Channel;
import campaign.model.ScheduledAction;
import campaign.schedule.StepDefinition;
import campaign.spi.MessageProvider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Shared fixtures for the JDBC-backed engine tests.
 */
final class TestSupport {

  static final Instant T0 = Instant.parse("2025-01-06T09:00:00Z");

  private TestSupport() {
  }

  static HikariDataSource h2(String name, int poolSize) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:" + name + "_" + UUID.randomUUID()
        + ";MODE=MySQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    config.setMaximumPoolSize(poolSize);
    config.setMinimumIdle(1);
    config.setPoolName("campaign-test-" + name);
    HikariDataSource dataSource = new HikariDataSource(config);
    createSchema(dataSource, "schema/h2.sql");
    return dataSource;
  }

  static void createSchema(DataSource dataSource, String location) {
    String script;
    try (InputStream in = TestSupport.class.getClassLoader().getResourceAsStream(location)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource " + location);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + location, e);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          st.execute(sql);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to create schema", e);
    }
  }

  static CampaignEngine.Builder engine(DataSource dataSource, Clock clock, MessageProvider... providers) {
    return CampaignEngine.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .stores(JdbcCampaignStores.detect(dataSource))
        .providers(List.of(providers))
        .leaseDuration(Duration.ofMinutes(5))
        .workerCount(1)
        .clock(clock);
  }

  static CampaignPlanVersion publish(CampaignEngine engine, String tenantId, StepDefinition... steps) {
    String templateId = engine.catalog().createTemplate(tenantId, "Onboarding").id();
    for (StepDefinition step : steps) {
      engine.catalog().addStep(tenantId, templateId, step);
    }
    return engine.catalog().publish(tenantId, templateId);
  }

  /**
   * Claims and dispatches due actions until nothing is due at the engine clock's current time.
   */
  static List<DispatchResult> runDue(CampaignEngine engine) {
    List<DispatchResult> results = new ArrayList<>();
    for (int round = 0; round < 50; round++) {
      List<ScheduledAction> claimed = engine.queue().claimDue(null, 10);
      if (claimed.isEmpty()) {
        return results;
      }
      for (ScheduledAction action : claimed) {
        results.add(engine.dispatcher().dispatch(action));
      }
    }
    throw new AssertionError("Queue did not drain: " + results);
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    void set(Instant instant) {
      now = instant;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  /**
   * Provider that records requests and replays scripted failures before succeeding.
   */
  static final class RecordingProvider implements MessageProvider {
    private final Channel channel;
    private final boolean completes;
    private final List<SendRequest> requests = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<Supplier<RuntimeException>> failures = new ConcurrentLinkedDeque<>();

    RecordingProvider(Channel channel, boolean completes) {
      this.channel = channel;
      this.completes = completes;
    }

    static RecordingProvider email() {
      return new RecordingProvider(Channel.EMAIL, false);
    }

    static RecordingProvider call() {
      return new RecordingProvider(Channel.CALL, true);
    }

    RecordingProvider failWith(Supplier<RuntimeException> failure) {
      failures.add(failure);
      return this;
    }

    List<SendRequest> requests() {
      return requests;
    }

    @Override
    public Channel channel() {
      return channel;
    }

    @Override
    public SendReceipt send(SendRequest request) {
      requests.add(request);
      Supplier<RuntimeException> failure = failures.poll();
      if (failure != null) {
        throw failure.get();
      }
      String providerMessageId = "prov-" + request.outboundMessageId();
      return completes ? SendReceipt.completed(providerMessageId) : SendReceipt.accepted(providerMessageId);
    }
  }
}
