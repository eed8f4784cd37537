package com.github.germanosin.lifeevents.cdc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;

/**
 * Starts pgoutput streams over a replication connection. The stream resumes from the slot's
 * confirmed flush position.
 */
@Slf4j
@RequiredArgsConstructor
public class PgReplicationConnector implements ReplicationConnector {
  private final PgConnectionFactory connectionFactory;

  @Override
  public ReplicationSession open(String slotName, Properties slotOptions) throws SQLException {
    final Connection replicationConnection = connectionFactory.getConnection(true);

    try {
      final PGConnection pgReplicationConnection =
          replicationConnection.unwrap(PGConnection.class);

      final ChainedLogicalStreamBuilder streamBuilder =
          pgReplicationConnection.getReplicationAPI()
              .replicationStream()
              .logical()
              .withSlotName(slotName)
              .withSlotOptions(slotOptions);

      final PGReplicationStream stream = streamBuilder.start();
      log.info("Started replication stream on slot {}", slotName);
      return new PgReplicationSession(replicationConnection, stream);
    } catch (final SQLException | RuntimeException e) {
      closeQuietly(replicationConnection, e);
      throw e;
    }
  }

  private static void closeQuietly(Connection connection, Exception failure) {
    try {
      connection.close();
    } catch (final SQLException e) {
      failure.addSuppressed(e);
    }
  }
}
