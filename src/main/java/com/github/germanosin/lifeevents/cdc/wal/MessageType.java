package com.github.germanosin.lifeevents.cdc.wal;

import java.util.Map;

public enum MessageType {
  RELATION,
  BEGIN,
  COMMIT,
  INSERT,
  UPDATE,
  DELETE,
  TYPE,
  ORIGIN,
  TRUNCATE,
  LOGICAL_DECODING_MESSAGE,
  UNKNOWN;

  static final Map<Character, MessageType> chars = Map.of(
      'R', RELATION,
      'B', BEGIN,
      'C', COMMIT,
      'I', INSERT,
      'U', UPDATE,
      'D', DELETE,
      'Y', TYPE,
      'O', ORIGIN,
      'T', TRUNCATE,
      'M', LOGICAL_DECODING_MESSAGE
  );

  /**
   * Resolves a pgoutput message tag. Tags added by newer protocol versions map to
   * {@link #UNKNOWN} so the stream keeps flowing.
   */
  public static MessageType forType(final char type) {
    return chars.getOrDefault(type, UNKNOWN);
  }
}
