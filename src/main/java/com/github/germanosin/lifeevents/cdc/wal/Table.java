package com.github.germanosin.lifeevents.cdc.wal;

import java.util.List;
import lombok.Data;

/**
 * Column layout of a relation as announced by the latest RELATION message.
 */
@Data
public class Table {
  private final String schema;
  private final String name;
  private final int relationId;
  private final List<ColumnMeta> columns;

  public String getQualifiedName() {
    return schema + "." + name;
  }
}
