package campaign.jdbc;

import campaign.gate.BlockReason;
import campaign.gate.SuppressionGate;
import campaign.model.Channel;
import campaign.model.CommunicationSuppression;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static campaign.jdbc.TestSupport.T0;
import static org.junit.jupiter.api.Assertions.*;

class SuppressionGateTest {
  private static final String TENANT = "acme";

  private HikariDataSource dataSource;
  private TestSupport.MutableClock clock;
  private SuppressionGate gate;

  @BeforeEach
  void setup() {
    dataSource = TestSupport.h2("suppression", 2);
    clock = new TestSupport.MutableClock(T0);
    gate = new SuppressionGate(new DataSourceConnectionProvider(dataSource),
        JdbcCampaignStores.detect(dataSource).suppressions(), clock);
  }

  @AfterEach
  void tearDown() {
    dataSource.close();
  }

  @Test
  void cleanAddressPasses() {
    assertEquals(Optional.empty(), gate.check(TENANT, Channel.EMAIL, "ada@example.com"));
    assertFalse(gate.isBlocked(TENANT, Channel.CALL, "+15550100000"));
  }

  @Test
  void blankAddressIsInvalid() {
    assertEquals(Optional.of(BlockReason.INVALID_ADDRESS), gate.check(TENANT, Channel.EMAIL, "  "));
    assertEquals(Optional.of(BlockReason.INVALID_ADDRESS), gate.check(TENANT, Channel.SMS, null));
  }

  @Test
  void lookupsUseNormalizedAddress() {
    gate.suppress(TENANT, Channel.EMAIL, "  Ada@Example.COM ", "complaint", null);
    gate.unsubscribe(TENANT, Channel.SMS, "+1 (555) 010-0000", "STOP reply");

    assertEquals(Optional.of(BlockReason.SUPPRESSED), gate.check(TENANT, Channel.EMAIL, "ada@example.com"));
    assertEquals(Optional.of(BlockReason.UNSUBSCRIBED), gate.check(TENANT, Channel.SMS, "+15550100000"));
    assertEquals(Optional.empty(), gate.check(TENANT, Channel.CALL, "+15550100000"));
    assertEquals(Optional.empty(), gate.check("globex", Channel.EMAIL, "ada@example.com"));
  }

  @Test
  void suppressionWinsOverUnsubscribeAndValidation() {
    String address = "ada@example.com";
    gate.recordValidation(TENANT, address, false, "mailbox does not exist");
    assertEquals(Optional.of(BlockReason.INVALID_ADDRESS), gate.check(TENANT, Channel.EMAIL, address));

    gate.unsubscribe(TENANT, Channel.EMAIL, address, "list-unsubscribe");
    assertEquals(Optional.of(BlockReason.UNSUBSCRIBED), gate.check(TENANT, Channel.EMAIL, address));

    gate.suppress(TENANT, Channel.EMAIL, address, "hard bounce", null);
    assertEquals(Optional.of(BlockReason.SUPPRESSED), gate.check(TENANT, Channel.EMAIL, address));

    assertTrue(gate.lift(TENANT, Channel.EMAIL, address));
    assertTrue(gate.resubscribe(TENANT, Channel.EMAIL, address));
    assertEquals(Optional.of(BlockReason.INVALID_ADDRESS), gate.check(TENANT, Channel.EMAIL, address));

    gate.recordValidation(TENANT, address, true, null);
    assertEquals(Optional.empty(), gate.check(TENANT, Channel.EMAIL, address));
  }

  @Test
  void temporarySuppressionExpires() {
    CommunicationSuppression suppression = gate.suppress(TENANT, Channel.SMS, "+15550100000", "carrier block",
        T0.plus(Duration.ofDays(1)));
    assertEquals("+15550100000", suppression.address());

    assertTrue(gate.isBlocked(TENANT, Channel.SMS, "+15550100000"));
    clock.advance(Duration.ofDays(1));
    assertFalse(gate.isBlocked(TENANT, Channel.SMS, "+15550100000"));
  }

  @Test
  void suppressingTwiceUpdatesTheEntry() {
    gate.suppress(TENANT, Channel.EMAIL, "ada@example.com", "soft bounce", T0.plusSeconds(60));
    gate.suppress(TENANT, Channel.EMAIL, "ada@example.com", "hard bounce", null);

    clock.advance(Duration.ofDays(30));
    assertEquals(Optional.of(BlockReason.SUPPRESSED), gate.check(TENANT, Channel.EMAIL, "ada@example.com"));
    assertFalse(gate.lift(TENANT, Channel.EMAIL, "other@example.com"));
  }
}
