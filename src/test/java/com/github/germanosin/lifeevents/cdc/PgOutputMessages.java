package com.github.germanosin.lifeevents.cdc;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builds pgoutput protocol version 1 messages the way the server sends them.
 */
final class PgOutputMessages {
  static final Object UNCHANGED = new Object();

  static final int OID_TEXT = 25;
  static final int OID_BOOL = 16;
  static final int OID_INT8 = 20;
  static final int OID_UUID = 2950;
  static final int OID_TIMESTAMPTZ = 1184;

  private PgOutputMessages() {
  }

  static final class Column {
    final String name;
    final int typeOid;
    final boolean key;

    Column(String name, int typeOid, boolean key) {
      this.name = name;
      this.typeOid = typeOid;
      this.key = key;
    }
  }

  static Column column(String name, int typeOid) {
    return new Column(name, typeOid, false);
  }

  static Column key(String name, int typeOid) {
    return new Column(name, typeOid, true);
  }

  static ByteBuffer relation(int relationId, String schema, String table, Column... columns) {
    return write(out -> {
      out.writeByte('R');
      out.writeInt(relationId);
      writeString(out, schema);
      writeString(out, table);
      out.writeByte('d');
      out.writeShort(columns.length);
      for (Column column : columns) {
        out.writeByte(column.key ? 1 : 0);
        writeString(out, column.name);
        out.writeInt(column.typeOid);
        out.writeInt(-1);
      }
    });
  }

  /**
   * Values are written in text format; {@code null} becomes a NULL column and
   * {@link #UNCHANGED} an unchanged TOAST column.
   */
  static ByteBuffer insert(int relationId, Object... values) {
    return write(out -> {
      out.writeByte('I');
      out.writeInt(relationId);
      out.writeByte('N');
      out.writeShort(values.length);
      for (Object value : values) {
        if (value == null) {
          out.writeByte('n');
        } else if (value == UNCHANGED) {
          out.writeByte('u');
        } else {
          byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
          out.writeByte('t');
          out.writeInt(bytes.length);
          out.write(bytes);
        }
      }
    });
  }

  static ByteBuffer begin(long finalLsn, long commitMicros, int xid) {
    return write(out -> {
      out.writeByte('B');
      out.writeLong(finalLsn);
      out.writeLong(commitMicros);
      out.writeInt(xid);
    });
  }

  static ByteBuffer commit(long commitLsn, long endLsn, long commitMicros) {
    return write(out -> {
      out.writeByte('C');
      out.writeByte(0);
      out.writeLong(commitLsn);
      out.writeLong(endLsn);
      out.writeLong(commitMicros);
    });
  }

  static ByteBuffer raw(int... bytes) {
    byte[] data = new byte[bytes.length];
    for (int i = 0; i < bytes.length; i++) {
      data[i] = (byte) bytes[i];
    }
    return ByteBuffer.wrap(data);
  }

  private interface Body {
    void write(DataOutputStream out) throws IOException;
  }

  private static ByteBuffer write(Body body) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      body.write(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return ByteBuffer.wrap(bytes.toByteArray());
  }

  private static void writeString(DataOutputStream out, String value) throws IOException {
    out.write(value.getBytes(StandardCharsets.UTF_8));
    out.writeByte(0);
  }
}
