package com.github.germanosin.lifeevents.cdc.exception;

/**
 * Publication or replication slot could not be ensured. Streaming cannot start.
 */
public class ProvisioningException extends RuntimeException {
  public ProvisioningException(String msg) {
    super(msg);
  }

  public ProvisioningException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
