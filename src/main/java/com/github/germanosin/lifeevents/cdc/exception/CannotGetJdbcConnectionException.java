package com.github.germanosin.lifeevents.cdc.exception;

/**
 * The driver refused to open a connection, in regular or replication mode.
 */
public class CannotGetJdbcConnectionException extends RuntimeException {
  private final boolean replicationMode;

  /**
   * Constructor for CannotGetJdbcConnectionException.
   * @param msg the detail message
   * @param replicationMode whether a replication connection was requested
   * @param cause the root cause, usually an SQLException
   */
  public CannotGetJdbcConnectionException(String msg, boolean replicationMode, Throwable cause) {
    super(msg + (replicationMode ? " (replication mode)" : ""), cause);
    this.replicationMode = replicationMode;
  }

  public boolean isReplicationMode() {
    return replicationMode;
  }
}
