package com.codeheadsystems.tether.testserver.cli;

import com.codeheadsystems.tether.server.store.SessionTokens;
import com.codeheadsystems.tether.server.store.SqliteSessionStore;
import com.codeheadsystems.tether.testserver.TestServerConfiguration;
import io.dropwizard.core.cli.ConfiguredCommand;
import io.dropwizard.core.setup.Bootstrap;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot purge of expired sessions, for running from cron when no front end runs the sweeper.
 */
public class SweepSessionsCommand extends ConfiguredCommand<TestServerConfiguration> {

  private static final Logger log = LoggerFactory.getLogger(SweepSessionsCommand.class);

  public SweepSessionsCommand() {
    super("sweep-sessions", "Delete expired rows from the shared session database");
  }

  @Override
  protected void run(Bootstrap<TestServerConfiguration> bootstrap,
                     Namespace namespace,
                     TestServerConfiguration configuration) {
    SqliteSessionStore store = new SqliteSessionStore(
        Path.of(configuration.getSessionDatabase()),
        Duration.ofMillis(configuration.getBusyTimeoutMillis()),
        new SessionTokens(new SecureRandom()),
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        Clock.systemUTC());
    int removed = store.sweepExpired();
    log.info("Removed {} expired session(s); {} still active", removed, store.countActive());
  }
}
