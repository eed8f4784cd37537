package com.github.germanosin.lifeevents.cdc.wal;

public interface Message {
  MessageType getMessageType();

  default boolean is(MessageType type) {
    return getMessageType().equals(type);
  }
}
