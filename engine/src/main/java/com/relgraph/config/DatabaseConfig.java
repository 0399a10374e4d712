package com.relgraph.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Connection settings for the PostgreSQL database used by the export/import and audit layers.
 *
 * @param url The JDBC URL, e.g. {@code jdbc:postgresql://localhost:5432/relgraph}
 * @param user The database user
 * @param password The database password, never logged
 */
public record DatabaseConfig(String url, String user, String password) {

  /** Reads {@code DB_URL}, {@code DB_USER} and {@code DB_PASSWORD}. */
  public static DatabaseConfig fromEnvironment(Map<String, String> env) {
    return new DatabaseConfig(env.get("DB_URL"), env.get("DB_USER"), env.get("DB_PASSWORD"));
  }

  /** Whether a JDBC URL was configured at all. */
  public boolean isConfigured() {
    return !Strings.isNullOrEmpty(url);
  }

  /**
   * Builds a HikariCP pool for this database.
   *
   * @return A configured HikariDataSource; the caller closes it
   */
  public HikariDataSource toDataSource() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setPoolName("relgraph-pool");

    Logger.info("Initializing database connection pool: {}", toSecureString());
    return new HikariDataSource(config);
  }

  /** Returns a string representation without the password, safe for logs. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this).add("url", url).add("user", user).toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
