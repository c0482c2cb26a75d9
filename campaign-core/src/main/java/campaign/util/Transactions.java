package campaign.util;

import campaign.spi.CampaignStoreException;
import campaign.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of store work on one connection with auto-commit disabled.
 *
 * <p>Commits when the work returns normally, rolls back on any exception. A
 * {@link SQLException} from the driver surfaces as {@link CampaignStoreException};
 * runtime exceptions thrown by the work propagate unchanged after the rollback.
 */
public final class Transactions {

  @FunctionalInterface
  public interface Work<T> {
    T execute(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  public interface VoidWork {
    void execute(Connection conn) throws SQLException;
  }

  private Transactions() {
  }

  public static <T> T inTransaction(ConnectionProvider connectionProvider, Work<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } catch (Error e) {
        rollbackQuietly(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new CampaignStoreException("Transaction failed", e);
    }
  }

  public static void run(ConnectionProvider connectionProvider, VoidWork work) {
    inTransaction(connectionProvider, conn -> {
      work.execute(conn);
      return null;
    });
  }

  private static void rollbackQuietly(Connection conn, Throwable cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
