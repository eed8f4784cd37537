package com.github.germanosin.lifeevents.cdc;

import com.github.germanosin.lifeevents.cdc.exception.ReplicationException;
import com.github.germanosin.lifeevents.cdc.exception.WalDecodingException;
import com.github.germanosin.lifeevents.cdc.wal.Message;
import com.github.germanosin.lifeevents.cdc.wal.TableRecord;
import java.nio.ByteBuffer;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.util.PSQLState;

/**
 * Drives a logical replication slot: provisions once, then streams, decodes and hands each
 * inserted row to the {@link CdcConsumer}, acknowledging every position after delivery.
 *
 * <p>The only fault that is retried is "replication slot is active" (another session still
 * holds the slot); the engine then waits {@link CdcSettings#getRecoveryBackoff()} and
 * reconnects. Every other failure ends {@link #run()} with an exception. {@link #stop()} or
 * interrupting the worker thread ends it normally.
 */
@Slf4j
public class CdcEngine implements Runnable {
  private final String slotName;
  private final Properties slotOptions;
  private final Duration recoveryBackoff;
  private final Duration pollInterval;

  private final Provisioner provisioner;
  private final ReplicationConnector connector;
  private final CdcConsumer cdcConsumer;
  private final LsnTracker lsnTracker = new LsnTracker();

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicLong skippedMessages = new AtomicLong();
  private final AtomicLong recoveries = new AtomicLong();

  private volatile EngineState state = EngineState.IDLE;
  private ReplicationSession session;
  private SQLException lastFault;

  public CdcEngine(CdcSettings settings, CdcConsumer cdcConsumer,
                   PgConnectionFactory connectionFactory) {
    this(settings, cdcConsumer,
        new PgProvisioner(connectionFactory, settings),
        new PgReplicationConnector(connectionFactory)
    );
  }

  public CdcEngine(CdcSettings settings, CdcConsumer cdcConsumer,
                   Provisioner provisioner, ReplicationConnector connector) {
    this.slotName = settings.getSlotName();
    this.slotOptions = settings.slotOptions();
    this.recoveryBackoff = settings.getRecoveryBackoff();
    this.pollInterval = settings.getPollInterval();
    this.cdcConsumer = cdcConsumer;
    this.provisioner = provisioner;
    this.connector = connector;
  }

  @Override
  public void run() {
    if (state != EngineState.IDLE) {
      throw new IllegalStateException("Engine already ran, state " + state);
    }

    EngineState next = EngineState.PROVISIONING;
    try {
      while (next != EngineState.STOPPED) {
        transition(next);
        switch (next) {
          case PROVISIONING:
            next = provision();
            break;
          case CONNECTING:
            next = connect();
            break;
          case STREAMING:
            next = stream();
            break;
          case RECOVERING:
            next = recover();
            break;
          default:
            throw new IllegalStateException("Unexpected engine state " + next);
        }
      }
    } finally {
      closeSession();
      transition(EngineState.STOPPED);
    }
  }

  /**
   * Requests shutdown. The worker notices within one poll interval, or at once when it is
   * waiting out a backoff.
   */
  public void stop() {
    stopSignal.countDown();
  }

  public EngineState getState() {
    return state;
  }

  public long getSkippedMessages() {
    return skippedMessages.get();
  }

  public long getRecoveries() {
    return recoveries.get();
  }

  public LogSequenceNumber getAcknowledgedLsn() {
    return lsnTracker.getAcknowledged();
  }

  private EngineState provision() {
    provisioner.provision();
    return isCancelled() ? EngineState.STOPPED : EngineState.CONNECTING;
  }

  private EngineState connect() {
    if (isCancelled()) {
      return EngineState.STOPPED;
    }
    try {
      session = connector.open(slotName, slotOptions);
      return EngineState.STREAMING;
    } catch (final SQLException e) {
      return onFault(e);
    } catch (final RuntimeException e) {
      throw new ReplicationException("Cannot open replication stream on slot " + slotName, e);
    }
  }

  private EngineState stream() {
    final PgWalMessageDecoder decoder = new PgWalMessageDecoder();
    cdcConsumer.markStarted();

    try {
      while (true) {
        if (isCancelled()) {
          log.info("Stop requested while streaming from slot {}", slotName);
          return EngineState.STOPPED;
        }

        final ByteBuffer buffer = session.readPending();

        if (buffer == null) {
          if (sleep(pollInterval)) {
            return EngineState.STOPPED;
          }
          continue;
        }

        final LogSequenceNumber lsn = session.getLastReceiveLsn();
        log.debug("processing LSN: {}", lsn);

        process(decoder, buffer, lsn);

        lsnTracker.advance(lsn);
        lsnTracker.acknowledge(session);
      }
    } catch (final SQLException e) {
      if (isCancelled()) {
        log.debug("Replication stream failed during shutdown", e);
        return EngineState.STOPPED;
      }
      return onFault(e);
    }
  }

  private void process(final PgWalMessageDecoder decoder, final ByteBuffer buffer,
                       final LogSequenceNumber lsn) {
    final Message message;
    try {
      message = decoder.decode(buffer, lsn);
    } catch (final WalDecodingException e) {
      long skipped = skippedMessages.incrementAndGet();
      log.warn("Skipping undecodable message at {} ({} skipped so far): {}",
          lsn, skipped, e.getMessage());
      return;
    }

    if (message instanceof TableRecord) {
      cdcConsumer.handle((TableRecord) message);
    }
  }

  private EngineState recover() {
    recoveries.incrementAndGet();
    log.warn("Replication slot {} is in use by another session, retrying in {} ms: {}",
        slotName, recoveryBackoff.toMillis(), lastFault.getMessage());
    closeSession();
    return sleep(recoveryBackoff) ? EngineState.STOPPED : EngineState.CONNECTING;
  }

  /**
   * Transition guard for RECOVERING: only an active slot is considered transient.
   */
  private EngineState onFault(final SQLException e) {
    closeSession();
    if (isSlotActive(e)) {
      lastFault = e;
      return EngineState.RECOVERING;
    }
    throw new ReplicationException("Replication from slot " + slotName + " failed", e);
  }

  static boolean isSlotActive(final Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SQLException
          && PSQLState.OBJECT_IN_USE.getState().equals(((SQLException) t).getSQLState())) {
        return true;
      }
    }
    return false;
  }

  private boolean isCancelled() {
    return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
  }

  /**
   * Waits for the given time or until stopped.
   *
   * @return whether the engine should stop
   */
  private boolean sleep(final Duration duration) {
    try {
      return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      log.warn("Replication thread interrupted");
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private void closeSession() {
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (final SQLException e) {
      log.error("Error while trying to close JDBC replication connection", e);
    } finally {
      session = null;
    }
  }

  private void transition(final EngineState nextState) {
    if (state != nextState) {
      log.info("Replication engine {} -> {}", state, nextState);
      state = nextState;
    }
  }
}
