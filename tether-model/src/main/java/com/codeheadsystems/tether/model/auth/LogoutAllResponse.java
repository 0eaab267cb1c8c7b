package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of signing a user out of every front end.
 *
 * @param sessionsRevoked number of sessions removed from the shared store
 */
public record LogoutAllResponse(@JsonProperty("sessionsRevoked") int sessionsRevoked) {
}
