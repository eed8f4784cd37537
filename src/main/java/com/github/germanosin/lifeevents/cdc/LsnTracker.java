package com.github.germanosin.lifeevents.cdc;

import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Highest processed WAL position and the last one reported to the server.
 *
 * <p>Positions only move forward: a redelivered message after a reconnect does not pull the
 * acknowledged position back. Only the replication worker thread uses an instance.
 */
@Slf4j
public class LsnTracker {
  private LogSequenceNumber processed = LogSequenceNumber.INVALID_LSN;
  private LogSequenceNumber acknowledged = LogSequenceNumber.INVALID_LSN;

  /**
   * Records a position whose message has been fully handed to the consumer.
   */
  public void advance(final LogSequenceNumber lsn) {
    if (lsn == null || LogSequenceNumber.INVALID_LSN.equals(lsn)) {
      return;
    }
    if (isAfter(lsn, processed)) {
      processed = lsn;
    } else {
      log.debug("Ignoring position {}, already processed up to {}", lsn, processed);
    }
  }

  /**
   * Sends the processed position to the server if it moved since the last call.
   *
   * @return whether a status update was sent
   */
  public boolean acknowledge(final ReplicationSession session) throws SQLException {
    if (!isAfter(processed, acknowledged)) {
      return false;
    }
    session.acknowledge(processed);
    acknowledged = processed;
    log.debug("Acknowledged {}", acknowledged);
    return true;
  }

  public LogSequenceNumber getProcessed() {
    return processed;
  }

  public LogSequenceNumber getAcknowledged() {
    return acknowledged;
  }

  private static boolean isAfter(LogSequenceNumber candidate, LogSequenceNumber current) {
    return Long.compareUnsigned(candidate.asLong(), current.asLong()) > 0;
  }
}
