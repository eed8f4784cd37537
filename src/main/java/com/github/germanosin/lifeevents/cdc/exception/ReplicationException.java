package com.github.germanosin.lifeevents.cdc.exception;

public class ReplicationException extends RuntimeException {
  public ReplicationException(String msg) {
    super(msg);
  }

  public ReplicationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
