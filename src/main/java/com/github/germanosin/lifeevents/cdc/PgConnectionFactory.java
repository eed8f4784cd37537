package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.exception.CannotGetJdbcConnectionException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import org.postgresql.PGProperty;

@RequiredArgsConstructor
public class PgConnectionFactory {

  private final String url;
  private final String userName;
  private final String password;
  private final String applicationName;

  public PgConnectionFactory(CdcSettings settings) {
    this(settings.getJdbcUrl(), settings.getUser(), settings.getPassword(),
        settings.getApplicationName());
  }

  public Connection getConnection() {
    return getConnection(false);
  }

  /**
   * Opens a connection. Replication connections speak the simple query protocol and can
   * run both SQL and replication commands.
   */
  public Connection getConnection(final boolean replicationMode) {
    final Properties props = new Properties();

    if (userName != null) {
      PGProperty.USER.set(props, userName);
    }
    if (password != null) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (applicationName != null) {
      PGProperty.APPLICATION_NAME.set(props, applicationName);
    }
    if (replicationMode) {
      PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
      PGProperty.REPLICATION.set(props, "database");
      PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    }

    try {
      return DriverManager.getConnection(url, props);
    } catch (final SQLException | IllegalStateException ex) {
      throw new CannotGetJdbcConnectionException(
          "Failed to obtain JDBC Connection to " + url, replicationMode, ex
      );
    }
  }
}
