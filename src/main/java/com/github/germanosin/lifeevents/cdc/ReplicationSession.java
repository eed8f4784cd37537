package com.github.germanosin.lifeevents.cdc;

import java.nio.ByteBuffer;
import java.sql.SQLException;
import org.postgresql.replication.LogSequenceNumber;

/**
 * One open logical replication stream.
 */
public interface ReplicationSession extends AutoCloseable {

  /**
   * Returns the next message, or {@code null} when nothing arrived yet. Never blocks for long.
   */
  ByteBuffer readPending() throws SQLException;

  /**
   * Position of the message last returned by {@link #readPending()}.
   */
  LogSequenceNumber getLastReceiveLsn();

  /**
   * Reports everything up to {@code lsn} as applied and flushed.
   */
  void acknowledge(LogSequenceNumber lsn) throws SQLException;

  @Override
  void close() throws SQLException;
}
