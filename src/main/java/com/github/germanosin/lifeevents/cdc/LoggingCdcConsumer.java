package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.wal.TableRecord;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingCdcConsumer implements CdcConsumer {
  private volatile boolean started;

  @Override
  public boolean isStarted() {
    return started;
  }

  @Override
  public void markStarted() {
    this.started = true;
  }

  @Override
  public void handle(TableRecord record) {
    log.info("Insert into {} at {} (committed {}): {}",
        record.getTable().getQualifiedName(),
        record.getLsn(),
        record.getCommitTime(),
        record.getValues()
    );
  }
}
