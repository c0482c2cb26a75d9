package campaign.jdbc.spi;

import campaign.model.ScheduledAction;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific pieces of the store layer: the atomic
 * claim of due actions and the "insert unless a unique key already exists" primitive.
 * Register custom dialects via {@code META-INF/services/campaign.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see campaign.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Atomically transitions up to {@code limit} due PENDING actions to CLAIMED and returns them.
   *
   * <p>Two concurrent callers must never receive the same action. Returned rows carry the
   * given {@code claimToken} and are ordered by {@code scheduled_at}.
   *
   * @param conn           JDBC connection (caller commits)
   * @param tenantId       restrict to one tenant, or {@code null} for all tenants
   * @param ownerId        worker identifier written to {@code claimed_by}
   * @param claimToken     fencing token for this claim batch
   * @param now            current time; actions with {@code scheduled_at <= now} are due
   * @param leaseExpiresAt lease deadline written to each claimed row
   * @param limit          max rows to claim
   * @return claimed actions
   */
  List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit);

  /**
   * Runs an INSERT and reports whether a row was written. A unique-key conflict is not an error.
   *
   * @param conn      JDBC connection
   * @param insertSql plain {@code INSERT INTO ... VALUES (...)} statement
   * @param params    bind parameters
   * @return {@code true} if inserted, {@code false} if a conflicting row already exists
   */
  boolean insertIfAbsent(Connection conn, String insertSql, Object... params);
}
