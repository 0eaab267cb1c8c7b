package com.codeheadsystems.tether.testserver;

import com.codeheadsystems.tether.dropwizard.TetherBundle;
import com.codeheadsystems.tether.testserver.cli.HashPasswordCommand;
import com.codeheadsystems.tether.testserver.cli.SweepSessionsCommand;
import com.codeheadsystems.tether.testserver.page.HomePageResource;
import com.codeheadsystems.tether.testserver.page.ReportsResource;
import com.codeheadsystems.tether.testserver.page.WhoAmIResource;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable sample front end. Start two copies on different ports against the same credential
 * file and session database to see a login carry over:
 * <pre>
 *   java -jar tether-testserver.jar server config/config.yml
 *   HTTP_PORT=8082 ADMIN_PORT=8083 TETHER_SERVLET_COOKIE=SIBLING_JSESSIONID \
 *       java -jar tether-testserver.jar server config/config.yml
 * </pre>
 */
public class TetherTestServerApplication extends Application<TestServerConfiguration> {

  private final TetherBundle<TestServerConfiguration> tetherBundle = new TetherBundle<>();

  public static void main(String[] args) throws Exception {
    new TetherTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "tether-testserver";
  }

  @Override
  public void initialize(Bootstrap<TestServerConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution so each copy can pick its own ports.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(tetherBundle);
    bootstrap.addCommand(new SweepSessionsCommand());
    bootstrap.addCommand(new HashPasswordCommand());
  }

  @Override
  public void run(TestServerConfiguration configuration, Environment environment) {
    environment.jersey().register(new HomePageResource(tetherBundle.getAuthService(), configuration.getSiblings()));
    environment.jersey().register(new WhoAmIResource());
    environment.jersey().register(new ReportsResource());
  }
}
