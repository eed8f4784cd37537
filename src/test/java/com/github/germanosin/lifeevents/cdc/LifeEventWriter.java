package com.github.germanosin.lifeevents.cdc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Writes rows into {@code life_events}, standing in for the application that produces them.
 */
class LifeEventWriter {
  static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS life_events (\n"
      + "    \"id\" uuid PRIMARY KEY,\n"
      + "    \"name\" text NOT NULL,\n"
      + "    \"positive\" boolean NOT NULL,\n"
      + "    \"timestamp\" timestamptz NOT NULL,\n"
      + "    \"note\" text\n"
      + ")";

  private final PgConnectionFactory connectionFactory;

  LifeEventWriter(PgConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
  }

  void createTable() throws SQLException {
    try (Connection connection = connectionFactory.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(CREATE_TABLE);
    }
  }

  UUID insert(String name) throws SQLException {
    return insert(name, null);
  }

  UUID insert(String name, String note) throws SQLException {
    final UUID id = UUID.randomUUID();
    try (Connection connection = connectionFactory.getConnection();
         PreparedStatement statement = connection.prepareStatement(
             "INSERT INTO life_events (id, name, positive, timestamp, note)"
                 + " VALUES (?, ?, ?, ?, ?)")) {
      statement.setObject(1, id);
      statement.setString(2, name);
      statement.setBoolean(3, true);
      statement.setObject(4, OffsetDateTime.now(ZoneOffset.UTC));
      statement.setString(5, note);
      statement.executeUpdate();
    }
    return id;
  }
}
