package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.wal.TableRecord;

/**
 * Receives inserted rows in commit order. {@link #handle(TableRecord)} is called on the
 * replication thread, and the record's position is acknowledged only after it returns.
 */
public interface CdcConsumer {
  boolean isStarted();

  /**
   * Called each time a replication stream has been opened.
   */
  void markStarted();

  void handle(TableRecord record);
}
