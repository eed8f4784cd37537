package com.github.germanosin.lifeevents.cdc.wal;

import lombok.Data;

@Data
public class ColumnMeta {
  private final String name;
  private final int typeOid;
  private final int typeModifier;
  private final int flags;
}
