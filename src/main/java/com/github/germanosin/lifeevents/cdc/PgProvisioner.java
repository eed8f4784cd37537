package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.exception.CannotGetJdbcConnectionException;
import com.github.germanosin.lifeevents.cdc.exception.ProvisioningException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;

/**
 * Creates the publication and the logical replication slot when they are missing. Existing
 * objects are left untouched, so running it on every start is safe.
 */
@Slf4j
@RequiredArgsConstructor
public class PgProvisioner implements Provisioner {
  private static final String DUPLICATE_OBJECT = "42710";
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

  private final PgConnectionFactory connectionFactory;
  private final CdcSettings settings;

  @Override
  public void provision() {
    ensurePublication(settings.getTableName());
    ensureSlot(settings.getSlotName(), settings.getPlugin());
  }

  /**
   * Creates the configured publication for {@code table} unless a publication with that name
   * exists. Check and creation run in one transaction.
   */
  public void ensurePublication(final String table) {
    final String publicationName = settings.getPublicationName();
    requireIdentifier("publication", publicationName);
    requireIdentifier("table", table);

    try (Connection connection = connectionFactory.getConnection()) {
      connection.setAutoCommit(false);
      try {
        if (publicationExists(connection, publicationName)) {
          log.info("Publication with name {} is already created", publicationName);
          warnIfTableMissing(connection, publicationName, table);
        } else {
          log.info("Creating publication {} for table {}", publicationName, table);
          try (Statement statement = connection.createStatement()) {
            statement.execute(
                String.format("CREATE PUBLICATION %s FOR TABLE %s", publicationName, table)
            );
          }
        }
        connection.commit();
      } catch (final SQLException e) {
        rollbackQuietly(connection, e);
        if (!DUPLICATE_OBJECT.equals(e.getSQLState())) {
          throw e;
        }
        log.info("Publication {} was created concurrently", publicationName);
      }
    } catch (final SQLException | CannotGetJdbcConnectionException e) {
      throw new ProvisioningException("Cannot ensure publication " + publicationName, e);
    }
    log.debug("Publication {} registered", publicationName);
  }

  /**
   * Creates a logical replication slot with the given output plugin unless it exists.
   */
  public void ensureSlot(final String slotName, final String plugin) {
    requireIdentifier("slot", slotName);

    try (Connection connection = connectionFactory.getConnection(true)) {
      if (slotExists(connection, slotName)) {
        log.info("Replication slot {} already exists", slotName);
      } else {
        log.info("Creating replication slot {} with plugin {}", slotName, plugin);
        try {
          connection.unwrap(PGConnection.class)
              .getReplicationAPI()
              .createReplicationSlot()
              .logical()
              .withSlotName(slotName)
              .withOutputPlugin(plugin)
              .make();
        } catch (final SQLException e) {
          if (!DUPLICATE_OBJECT.equals(e.getSQLState())) {
            throw e;
          }
          log.info("Replication slot {} was created concurrently", slotName);
        }
      }
    } catch (final SQLException | CannotGetJdbcConnectionException e) {
      throw new ProvisioningException("Cannot ensure replication slot " + slotName, e);
    }
    log.debug("Replication slot {} registered", slotName);
  }

  static void rollbackQuietly(final Connection connection, final SQLException failure) {
    try {
      connection.rollback();
    } catch (final SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static boolean publicationExists(final Connection connection, final String name)
      throws SQLException {
    return exists(connection,
        "SELECT EXISTS (SELECT oid FROM pg_publication WHERE pubname = ?)", name);
  }

  private static boolean slotExists(final Connection connection, final String name)
      throws SQLException {
    return exists(connection,
        "SELECT EXISTS (SELECT slot_name FROM pg_replication_slots WHERE slot_name = ?)", name);
  }

  private static boolean exists(final Connection connection, final String query,
                                final String name) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(query)) {
      statement.setString(1, name);
      try (ResultSet resultSet = statement.executeQuery()) {
        resultSet.next();
        return resultSet.getBoolean(1);
      }
    }
  }

  private static void warnIfTableMissing(final Connection connection, final String publication,
                                         final String table) throws SQLException {
    final String tableName = table.contains(".") ? table.substring(table.indexOf('.') + 1) : table;
    final String query = "SELECT EXISTS (SELECT 1 FROM pg_publication_tables"
        + " WHERE pubname = ? AND tablename = ?)";
    try (PreparedStatement statement = connection.prepareStatement(query)) {
      statement.setString(1, publication);
      statement.setString(2, tableName);
      try (ResultSet resultSet = statement.executeQuery()) {
        resultSet.next();
        if (!resultSet.getBoolean(1)) {
          log.warn("Publication {} exists but does not cover table {}", publication, table);
        }
      }
    }
  }

  private static void requireIdentifier(final String kind, final String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new ProvisioningException("Invalid " + kind + " name: " + name);
    }
  }
}
