package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to "may the caller see a page that requires this level".
 *
 * @param level   the required level that was asked about
 * @param granted whether the caller's role meets it
 */
public record AccessResponse(
    @JsonProperty("level") String level,
    @JsonProperty("granted") boolean granted) {
}
