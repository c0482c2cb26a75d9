package campaign.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCampaignStoresTest {

  @Test
  void forDialectPicksSchemaScript() {
    assertEquals("schema/postgresql.sql", JdbcCampaignStores.forDialect("postgresql").schemaLocation());
    assertEquals("schema/mysql.sql", JdbcCampaignStores.forDialect("MySQL").schemaLocation());
    assertEquals("schema/h2.sql", JdbcCampaignStores.forDialect("h2").schemaLocation());
  }

  @Test
  void everySchemaScriptIsOnTheClasspath() {
    for (String name : new String[]{"h2", "mysql", "postgresql"}) {
      String location = JdbcCampaignStores.forDialect(name).schemaLocation();
      assertNotNull(getClass().getClassLoader().getResource(location), location);
    }
  }

  @Test
  void detectUsesDataSourceUrl() {
    try (HikariDataSource dataSource = TestSupport.h2("stores", 1)) {
      JdbcCampaignStores stores = JdbcCampaignStores.detect(dataSource);
      assertEquals("h2", stores.dialect().name());
      assertNotNull(stores.actions());
      assertNotNull(stores.webhooks());
    }
  }

  @Test
  void jdbcTemplateTruncatesLongErrors() {
    String longError = "x".repeat(JdbcTemplate.MAX_ERROR_LENGTH + 50);
    assertEquals(JdbcTemplate.MAX_ERROR_LENGTH, JdbcTemplate.truncate(longError).length());
    assertNull(JdbcTemplate.truncate(null));
    assertEquals("short", JdbcTemplate.truncate("short"));
  }
}
