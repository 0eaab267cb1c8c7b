package com.codeheadsystems.tether.testserver.cli;

import com.codeheadsystems.tether.dropwizard.TetherBundle;
import com.codeheadsystems.tether.server.auth.PasswordVerifier;
import com.codeheadsystems.tether.testserver.TestServerConfiguration;
import io.dropwizard.core.cli.ConfiguredCommand;
import io.dropwizard.core.setup.Bootstrap;
import java.io.PrintStream;
import java.security.SecureRandom;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

/**
 * Prints an Argon2id hash for pasting into the credential file by hand.
 */
public class HashPasswordCommand extends ConfiguredCommand<TestServerConfiguration> {

  private final PrintStream out;

  public HashPasswordCommand() {
    this(System.out);
  }

  HashPasswordCommand(PrintStream out) {
    super("hash-password", "Hash a password with the configured Argon2id parameters");
    this.out = out;
  }

  @Override
  public void configure(Subparser subparser) {
    super.configure(subparser);
    subparser.addArgument("password")
        .required(true)
        .help("plaintext password to hash");
  }

  @Override
  protected void run(Bootstrap<TestServerConfiguration> bootstrap,
                     Namespace namespace,
                     TestServerConfiguration configuration) {
    PasswordVerifier verifier = new PasswordVerifier(
        TetherBundle.argon2Settings(configuration), new SecureRandom());
    out.println(verifier.hash(namespace.getString("password")));
  }
}
