package com.scholary.audiobook.events;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Emits {@code HEARTBEAT} events at a fixed interval while a phase is running.
 *
 * <p>Runs on its own scheduled thread so it keeps ticking while a single chunk spends minutes in
 * the backend.
 */
public class Heartbeat implements AutoCloseable {

  private final ScheduledExecutorService scheduler;

  private Heartbeat(ScheduledExecutorService scheduler) {
    this.scheduler = scheduler;
  }

  /**
   * Start ticking. The first beat is sent after one interval.
   *
   * @param emitter where beats go
   * @param interval time between beats
   */
  public static Heartbeat start(EventEmitter emitter, Duration interval) {
    return start(emitter, interval, Clock.systemUTC());
  }

  static Heartbeat start(EventEmitter emitter, Duration interval, Clock clock) {
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "heartbeat");
              thread.setDaemon(true);
              return thread;
            });
    long millis = interval.toMillis();
    scheduler.scheduleAtFixedRate(
        () -> emitter.heartbeat(clock.millis()), millis, millis, TimeUnit.MILLISECONDS);
    return new Heartbeat(scheduler);
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }
}
