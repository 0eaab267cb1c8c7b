package com.codeheadsystems.tether.testserver.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.server.auth.Argon2Settings;
import com.codeheadsystems.tether.server.auth.PasswordVerifier;
import com.codeheadsystems.tether.testserver.TestServerConfiguration;
import com.codeheadsystems.tether.testserver.TetherTestServerApplication;
import io.dropwizard.core.setup.Bootstrap;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Map;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.jupiter.api.Test;

class HashPasswordCommandTest {

  @Test
  void run_printsVerifiableArgon2idHash() {
    TestServerConfiguration configuration = new TestServerConfiguration();
    configuration.setArgon2MemoryKib(1024);
    configuration.setArgon2Iterations(1);
    configuration.setArgon2Parallelism(1);
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    HashPasswordCommand command =
        new HashPasswordCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    command.run(new Bootstrap<>(new TetherTestServerApplication()),
        new Namespace(Map.of("password", "correct-horse")), configuration);

    String hash = buffer.toString(StandardCharsets.UTF_8).trim();
    assertThat(hash).startsWith("$argon2id$").contains("m=1024,t=1,p=1");
    PasswordVerifier verifier = new PasswordVerifier(new Argon2Settings(1024, 1, 1), new SecureRandom());
    assertThat(verifier.verify("correct-horse", hash)).isEqualTo(PasswordVerifier.Verification.MATCH);
    assertThat(verifier.verify("wrong", hash).matched()).isFalse();
  }
}
