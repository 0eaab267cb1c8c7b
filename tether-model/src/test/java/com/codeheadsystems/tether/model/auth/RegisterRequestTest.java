package com.codeheadsystems.tether.model.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class RegisterRequestTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void missingRole_deserializesAsNull() throws Exception {
    RegisterRequest request = mapper.readValue(
        "{\"username\":\"bob\",\"password\":\"pw\",\"email\":\"b@x.com\",\"displayName\":\"Bob\"}",
        RegisterRequest.class);

    assertThat(request.username()).isEqualTo("bob");
    assertThat(request.displayName()).isEqualTo("Bob");
    assertThat(request.role()).isNull();
  }

  @Test
  void toString_neverContainsPassword() {
    RegisterRequest request = new RegisterRequest("bob", "s3cret-value", "b@x.com", "Bob", "user");

    assertThat(request.toString()).doesNotContain("s3cret-value");
  }
}
