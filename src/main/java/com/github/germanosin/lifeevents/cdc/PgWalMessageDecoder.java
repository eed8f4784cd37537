package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.exception.WalDecodingException;
import com.github.germanosin.lifeevents.cdc.wal.ColumnMeta;
import com.github.germanosin.lifeevents.cdc.wal.ColumnValueKind;
import com.github.germanosin.lifeevents.cdc.wal.IgnoredMessage;
import com.github.germanosin.lifeevents.cdc.wal.Message;
import com.github.germanosin.lifeevents.cdc.wal.MessageType;
import com.github.germanosin.lifeevents.cdc.wal.Table;
import com.github.germanosin.lifeevents.cdc.wal.TableColumn;
import com.github.germanosin.lifeevents.cdc.wal.TableRecord;
import com.github.germanosin.lifeevents.cdc.wal.TxMessage;
import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Decodes pgoutput (protocol version 1) messages.
 *
 * <p>Relation descriptions are cached by relation id and replaced whenever the server sends a
 * new one, so inserts are always mapped with the latest column layout. An instance belongs to
 * a single replication session and performs no I/O.
 */
@Slf4j
public class PgWalMessageDecoder {
  // 2000-01-01T00:00:00Z
  private static final long PG_EPOCH_SECONDS = 946_684_800L;

  private final Map<Integer, Table> tables = new HashMap<>();
  private Instant currentCommitTime;

  public Message decode(final ByteBuffer buffer, final LogSequenceNumber lsn) {
    if (!buffer.hasRemaining()) {
      throw new WalDecodingException("Empty message at " + lsn);
    }

    final char tag = (char) buffer.get();
    final MessageType messageType = MessageType.forType(tag);

    log.debug("Received message type {} at {}", messageType, lsn);

    try {
      switch (messageType) {
        case RELATION:
          handleRelationMessage(buffer);
          return new IgnoredMessage(MessageType.RELATION);
        case INSERT:
          return decodeInsertMessage(buffer, lsn);
        case BEGIN:
          return decodeBeginMessage(buffer);
        case COMMIT:
          return decodeCommitMessage(buffer);
        case UNKNOWN:
          log.debug("Skipping unsupported message tag '{}' at {}", tag, lsn);
          return new IgnoredMessage(MessageType.UNKNOWN);
        default:
          return new IgnoredMessage(messageType);
      }
    } catch (BufferUnderflowException e) {
      throw new WalDecodingException(
          "Truncated " + messageType + " message at " + lsn, e
      );
    }
  }

  private void handleRelationMessage(final ByteBuffer buffer) {
    final int relationId = buffer.getInt();
    final String schemaName = readString(buffer);
    final String tableName = readString(buffer);
    // replica identity setting, not needed for inserts
    buffer.get();
    final int columnCount = Short.toUnsignedInt(buffer.getShort());

    final List<ColumnMeta> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      final int flags = buffer.get();
      final String name = readString(buffer);
      final int typeOid = buffer.getInt();
      final int typeModifier = buffer.getInt();
      columns.add(new ColumnMeta(name, typeOid, typeModifier, flags));
    }

    final Table previous = tables.put(relationId,
        new Table(schemaName, tableName, relationId, Collections.unmodifiableList(columns)));

    if (previous != null && !previous.getColumns().equals(columns)) {
      log.info("Relation {}.{} ({}) changed from {} to {} columns",
          schemaName, tableName, relationId, previous.getColumns().size(), columnCount);
    } else {
      log.debug("Schema: '{}', Table: '{}', RelationId: {}, Columns: {}",
          schemaName, tableName, relationId, columnCount);
    }
  }

  private TableRecord decodeInsertMessage(final ByteBuffer buffer, final LogSequenceNumber lsn) {
    final int relationId = buffer.getInt();

    final char tupleType = (char) buffer.get();
    if (tupleType != 'N') {
      throw new WalDecodingException("Unexpected tuple type '" + tupleType + "' for INSERT");
    }

    final Table table = tables.get(relationId);
    if (table == null) {
      throw new WalDecodingException("No column meta for relation ID " + relationId);
    }

    return new TableRecord(
        table,
        readTupleDataForColumns(buffer, table),
        lsn,
        currentCommitTime
    );
  }

  private TxMessage decodeBeginMessage(final ByteBuffer buffer) {
    final LogSequenceNumber finalLsn = LogSequenceNumber.valueOf(buffer.getLong());
    currentCommitTime = fromPgEpochMicros(buffer.getLong());
    final int xid = buffer.getInt();
    return new TxMessage(MessageType.BEGIN, finalLsn, currentCommitTime, xid);
  }

  private TxMessage decodeCommitMessage(final ByteBuffer buffer) {
    // flags, unused
    buffer.get();
    final LogSequenceNumber commitLsn = LogSequenceNumber.valueOf(buffer.getLong());
    // end LSN of the transaction
    buffer.getLong();
    final Instant commitTime = fromPgEpochMicros(buffer.getLong());
    currentCommitTime = null;
    return new TxMessage(MessageType.COMMIT, commitLsn, commitTime, null);
  }

  private Map<String, TableColumn> readTupleDataForColumns(final ByteBuffer buffer,
                                                           final Table table) {
    final List<ColumnMeta> columnMetaList = table.getColumns();
    final int numberOfColumns = Short.toUnsignedInt(buffer.getShort());

    if (numberOfColumns != columnMetaList.size()) {
      throw new WalDecodingException(String.format(
          "Tuple has %d columns but relation %s describes %d",
          numberOfColumns, table.getQualifiedName(), columnMetaList.size()
      ));
    }

    final Map<String, TableColumn> columns = new LinkedHashMap<>();

    for (int i = 0; i < numberOfColumns; ++i) {
      final ColumnMeta columnMeta = columnMetaList.get(i);
      final ColumnValueKind kind;
      try {
        kind = ColumnValueKind.forType((char) buffer.get());
      } catch (IllegalArgumentException e) {
        throw new WalDecodingException(
            "Column " + columnMeta.getName() + ": " + e.getMessage(), e
        );
      }

      switch (kind) {
        case TEXT:
          columns.put(columnMeta.getName(),
              TableColumn.text(columnMeta, readColumnValueAsString(buffer)));
          break;
        case NULL:
          columns.put(columnMeta.getName(), TableColumn.ofNull(columnMeta));
          break;
        default:
          log.debug("Column: {}, Value: UNCHANGED", columnMeta.getName());
          columns.put(columnMeta.getName(), TableColumn.unchanged(columnMeta));
          break;
      }
    }

    return Collections.unmodifiableMap(columns);
  }

  private static Instant fromPgEpochMicros(final long micros) {
    final long seconds = Math.floorDiv(micros, 1_000_000L);
    final long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  private static String readString(final ByteBuffer buffer) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte b;
    while ((b = buffer.get()) != 0) {
      out.write(b);
    }
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private static String readColumnValueAsString(final ByteBuffer buffer) {
    final int length = buffer.getInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new WalDecodingException("Invalid column value length " + length);
    }
    final byte[] value = new byte[length];
    buffer.get(value, 0, length);
    return new String(value, StandardCharsets.UTF_8);
  }
}
