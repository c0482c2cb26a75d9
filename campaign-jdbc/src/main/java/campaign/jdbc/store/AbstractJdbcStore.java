package campaign.jdbc.store;

import campaign.jdbc.spi.Dialect;
import campaign.model.SendWindow;
import campaign.util.JsonCodec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for the JDBC stores: holds the dialect and the codec for JSON map columns.
 */
abstract class AbstractJdbcStore {

  protected final Dialect dialect;
  protected final JsonCodec jsonCodec;

  protected AbstractJdbcStore(Dialect dialect, JsonCodec jsonCodec) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  protected String json(Map<String, String> values) {
    return jsonCodec.toJson(values);
  }

  protected Map<String, String> map(ResultSet rs, String column) throws SQLException {
    return jsonCodec.parseObject(rs.getString(column));
  }

  protected static Long millis(Duration duration) {
    return duration == null ? null : duration.toMillis();
  }

  protected static Duration duration(ResultSet rs, String column) throws SQLException {
    return Duration.ofMillis(rs.getLong(column));
  }

  protected static String window(SendWindow window) {
    return window == null ? null : window.toString();
  }

  protected static SendWindow window(ResultSet rs, String column) throws SQLException {
    String text = rs.getString(column);
    return text == null ? null : SendWindow.parse(text);
  }
}
