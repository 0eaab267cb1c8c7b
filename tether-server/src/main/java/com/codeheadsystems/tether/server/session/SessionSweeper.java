package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.store.SessionStore;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically bulk-deletes expired sessions on a single daemon thread.
 * <p>
 * Every front end may run one; concurrent sweeps are harmless.
 */
public class SessionSweeper {

  private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

  private final SessionStore sessionStore;
  private final Duration interval;
  private final ScheduledExecutorService executor =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tether-session-sweeper");
        t.setDaemon(true);
        return t;
      });

  public SessionSweeper(SessionStore sessionStore, Duration interval) {
    this.sessionStore = sessionStore;
    this.interval = interval;
  }

  public void start() {
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::sweepOnce, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Session sweeper started, interval={}", interval);
  }

  /**
   * Runs one sweep. Failures are logged and the schedule continues.
   *
   * @return sessions removed, or -1 if the store was unavailable
   */
  public int sweepOnce() {
    try {
      int removed = sessionStore.sweepExpired();
      if (removed > 0) {
        log.info("Swept {} expired session(s)", removed);
      }
      return removed;
    } catch (RuntimeException e) {
      log.warn("Session sweep failed: {}", e.getMessage());
      return -1;
    }
  }

  /**
   * Shuts down the sweeper thread. In Dropwizard, this runs from a {@code Managed} stop.
   */
  public void shutdown() {
    executor.shutdown();
  }
}
