package campaign.jdbc.dialect;

import campaign.jdbc.spi.Dialect;
import campaign.spi.CampaignStoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Dialects registered under {@code META-INF/services/campaign.jdbc.spi.Dialect}, looked up
 * by name or matched against a JDBC URL.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      Dialect previous = byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
      if (previous != null) {
        throw new IllegalStateException("Dialect " + dialect.name() + " registered twice: "
            + previous.getClass().getName() + ", " + dialect.getClass().getName());
      }
    }
    return byName;
  }

  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Objects.requireNonNull(name, "name");
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Reads the JDBC URL from one pooled connection and matches it.
   *
   * @throws CampaignStoreException if no connection could be obtained
   * @throws IllegalArgumentException if the URL matches no dialect
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new CampaignStoreException("Cannot read JDBC URL to detect dialect", e);
    }
    return detect(url);
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or matches no dialect
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    return BY_NAME.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(lower::startsWith))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
            + ". Supported prefixes: " + BY_NAME.values().stream()
            .flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }
}
