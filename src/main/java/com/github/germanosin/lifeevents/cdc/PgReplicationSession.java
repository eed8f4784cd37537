package com.github.germanosin.lifeevents.cdc;

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;

@Slf4j
@RequiredArgsConstructor
class PgReplicationSession implements ReplicationSession {
  private final Connection connection;
  private final PGReplicationStream stream;

  @Override
  public ByteBuffer readPending() throws SQLException {
    return stream.readPending();
  }

  @Override
  public LogSequenceNumber getLastReceiveLsn() {
    return stream.getLastReceiveLSN();
  }

  @Override
  public void acknowledge(LogSequenceNumber lsn) throws SQLException {
    stream.setAppliedLSN(lsn);
    stream.setFlushedLSN(lsn);
    stream.forceUpdateStatus();
  }

  @Override
  public void close() throws SQLException {
    try {
      if (!stream.isClosed()) {
        stream.close();
      }
    } finally {
      connection.close();
      log.debug("Replication connection closed");
    }
  }
}
