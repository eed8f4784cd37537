package com.github.germanosin.lifeevents.cdc.exception;

/**
 * A pgoutput message could not be turned into an event: truncated buffer, unexpected tuple
 * layout or a row for a relation that was never described in this session.
 */
public class WalDecodingException extends RuntimeException {
  public WalDecodingException(String msg) {
    super(msg);
  }

  public WalDecodingException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
