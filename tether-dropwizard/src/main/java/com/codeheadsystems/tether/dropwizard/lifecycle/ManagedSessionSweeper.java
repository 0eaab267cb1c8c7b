package com.codeheadsystems.tether.dropwizard.lifecycle;

import com.codeheadsystems.tether.server.session.SessionSweeper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the {@link SessionSweeper} thread to the application lifecycle.
 */
public class ManagedSessionSweeper implements Managed {

  private final SessionSweeper sweeper;

  public ManagedSessionSweeper(SessionSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Override
  public void start() {
    sweeper.start();
  }

  @Override
  public void stop() {
    sweeper.shutdown();
  }
}
