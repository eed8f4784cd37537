package com.github.germanosin.lifeevents.cdc.wal;

import java.time.Instant;
import lombok.Data;
import org.postgresql.replication.LogSequenceNumber;

/**
 * BEGIN or COMMIT boundary of a transaction. {@code xid} is only sent with BEGIN.
 */
@Data
public class TxMessage implements Message {
  private final MessageType messageType;
  private final LogSequenceNumber lsn;
  private final Instant commitTime;
  private final Integer xid;
}
