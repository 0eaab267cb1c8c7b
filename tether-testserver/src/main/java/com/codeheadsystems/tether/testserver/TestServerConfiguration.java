package com.codeheadsystems.tether.testserver;

import com.codeheadsystems.tether.dropwizard.TetherConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the sample front end: the shared Tether settings plus the sibling front ends
 * the home page links to.
 */
public class TestServerConfiguration extends TetherConfiguration {

  /**
   * Base URLs of sibling front ends, e.g. {@code http://localhost:8082/}.
   */
  @NotNull
  private List<String> siblings = new ArrayList<>();

  @JsonProperty
  public List<String> getSiblings() {
    return siblings;
  }

  @JsonProperty
  public void setSiblings(List<String> siblings) {
    this.siblings = siblings;
  }
}
