package com.github.germanosin.lifeevents.cdc.wal;

import java.util.Map;

/**
 * How a column appeared in a pgoutput tuple.
 */
public enum ColumnValueKind {
  /** Value sent in text format. */
  TEXT,
  /** SQL NULL. */
  NULL,
  /** TOASTed value the server did not send because it did not change. */
  UNCHANGED;

  private static final Map<Character, ColumnValueKind> kinds = Map.of(
      't', TEXT,
      'n', NULL,
      'u', UNCHANGED
  );

  public static ColumnValueKind forType(final char type) {
    ColumnValueKind result = kinds.get(type);
    if (result == null) {
      throw new IllegalArgumentException("Unsupported tuple data kind: " + type);
    }
    return result;
  }
}
