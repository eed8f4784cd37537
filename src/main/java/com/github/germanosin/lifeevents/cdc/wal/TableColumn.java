package com.github.germanosin.lifeevents.cdc.wal;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.UUID;
import java.util.function.Function;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Data
public class TableColumn {
  static final int OID_BOOL = 16;
  static final int OID_INT8 = 20;
  static final int OID_INT2 = 21;
  static final int OID_INT4 = 23;
  static final int OID_TEXT = 25;
  static final int OID_FLOAT4 = 700;
  static final int OID_FLOAT8 = 701;
  static final int OID_VARCHAR = 1043;
  static final int OID_TIMESTAMP = 1114;
  static final int OID_TIMESTAMPTZ = 1184;
  static final int OID_NUMERIC = 1700;
  static final int OID_UUID = 2950;

  // Text output of timestamp columns: "2024-01-02 03:04:05.123456+00"
  private static final DateTimeFormatter PG_TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .appendPattern("HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .toFormatter();

  private static final DateTimeFormatter PG_TIMESTAMPTZ = new DateTimeFormatterBuilder()
      .append(PG_TIMESTAMP)
      .appendPattern("[XXX][XX][X]")
      .toFormatter();

  private final String name;
  private final int typeOid;
  private final ColumnValueKind kind;
  private final String value;

  public static TableColumn text(ColumnMeta meta, String value) {
    return new TableColumn(meta.getName(), meta.getTypeOid(), ColumnValueKind.TEXT, value);
  }

  public static TableColumn ofNull(ColumnMeta meta) {
    return new TableColumn(meta.getName(), meta.getTypeOid(), ColumnValueKind.NULL, null);
  }

  public static TableColumn unchanged(ColumnMeta meta) {
    return new TableColumn(meta.getName(), meta.getTypeOid(), ColumnValueKind.UNCHANGED, null);
  }

  public Long asInt64() {
    return notNull(Long::valueOf);
  }

  public Integer asInt32() {
    return notNull(Integer::valueOf);
  }

  public String asString() {
    return value;
  }

  public Boolean asBoolean() {
    return notNull(v -> "t".equalsIgnoreCase(v) || "true".equalsIgnoreCase(v));
  }

  public BigDecimal asBigDecimal() {
    return notNull(BigDecimal::new);
  }

  public UUID asUuid() {
    return notNull(UUID::fromString);
  }

  public OffsetDateTime asOffsetDateTime() {
    return notNull(v -> OffsetDateTime.parse(v, PG_TIMESTAMPTZ));
  }

  public LocalDateTime asLocalDateTime() {
    return notNull(v -> LocalDateTime.parse(v, PG_TIMESTAMP));
  }

  public boolean isNull() {
    return kind == ColumnValueKind.NULL;
  }

  public boolean isUnchanged() {
    return kind == ColumnValueKind.UNCHANGED;
  }

  /**
   * Converts the text form according to the column type. Types without a mapping, and values
   * the mapping cannot represent ({@code infinity}, {@code NaN}, BC dates), are returned as
   * text; {@code null} for NULL and UNCHANGED columns.
   */
  public Object getTypedValue() {
    if (value == null) {
      return null;
    }
    try {
      return convert();
    } catch (RuntimeException e) {
      log.debug("Keeping {} value of column {} as text: {}", typeOid, name, e.getMessage());
      return value;
    }
  }

  private Object convert() {
    switch (typeOid) {
      case OID_BOOL:
        return asBoolean();
      case OID_INT2:
      case OID_INT4:
        return asInt32();
      case OID_INT8:
        return asInt64();
      case OID_FLOAT4:
      case OID_FLOAT8:
        return Double.valueOf(value);
      case OID_NUMERIC:
        return asBigDecimal();
      case OID_UUID:
        return asUuid();
      case OID_TIMESTAMPTZ:
        return asOffsetDateTime();
      case OID_TIMESTAMP:
        return asLocalDateTime();
      default:
        return value;
    }
  }

  private <T> T notNull(Function<String, T> function) {
    return value != null ? function.apply(value) : null;
  }
}
