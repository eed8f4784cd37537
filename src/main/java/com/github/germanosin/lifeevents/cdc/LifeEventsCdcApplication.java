package com.github.germanosin.lifeevents.cdc;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the engine with the logging consumer until the JVM is asked to shut down.
 * Exits with status 1 when the engine fails.
 */
@Slf4j
public final class LifeEventsCdcApplication {
  private LifeEventsCdcApplication() {
  }

  public static void main(String[] args) throws InterruptedException {
    final CdcSettings settings = CdcSettings.load();
    log.info("Streaming inserts of {} through slot {} and publication {}",
        settings.getTableName(), settings.getSlotName(), settings.getPublicationName());

    final CdcEngine engine = new CdcEngine(
        settings,
        new LoggingCdcConsumer(),
        new PgConnectionFactory(settings)
    );

    final AtomicReference<Throwable> failure = new AtomicReference<>();
    final Thread worker = new Thread(() -> {
      try {
        engine.run();
      } catch (RuntimeException e) {
        failure.set(e);
        log.error("Replication engine failed", e);
      }
    }, "cdc-" + settings.getSlotName());

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested");
      engine.stop();
      try {
        worker.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "cdc-shutdown"));

    worker.start();
    worker.join();

    if (failure.get() != null) {
      System.exit(1);
    }
  }
}
