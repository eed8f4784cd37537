package com.github.germanosin.lifeevents.cdc.wal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.postgresql.replication.LogSequenceNumber;

/**
 * One inserted row. Columns keep the order of the relation description, and every column
 * of the relation has an entry, including NULL and UNCHANGED ones.
 */
@Data
public class TableRecord implements Message {
  private final Table table;
  private final Map<String, TableColumn> columns;
  private final LogSequenceNumber lsn;
  private final Instant commitTime;

  @Override
  public MessageType getMessageType() {
    return MessageType.INSERT;
  }

  public Optional<TableColumn> getColumn(final String columnName) {
    return Optional.ofNullable(
        this.columns.get(columnName)
    );
  }

  /**
   * Column name to typed value. NULL columns map to {@code null}, UNCHANGED columns to
   * {@link ColumnValueKind#UNCHANGED}.
   */
  public Map<String, Object> getValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    columns.forEach((name, column) -> values.put(name,
        column.isUnchanged() ? ColumnValueKind.UNCHANGED : column.getTypedValue()));
    return values;
  }
}
