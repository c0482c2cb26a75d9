package campaign.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the engine's components. Callers close what they get.
 *
 * @see campaign.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
