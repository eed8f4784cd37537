package com.github.germanosin.lifeevents.cdc.wal;

import lombok.Data;

/**
 * A message that carries nothing for the consumer: relation descriptions, row changes other
 * than inserts and tags this decoder does not know.
 */
@Data
public class IgnoredMessage implements Message {
  private final MessageType messageType;
}
