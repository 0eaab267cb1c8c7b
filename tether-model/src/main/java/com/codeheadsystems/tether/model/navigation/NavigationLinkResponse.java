package com.codeheadsystems.tether.model.navigation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A link to a sibling front end, carrying the caller's session token when there is one.
 * <p>
 * Used by: {@code GET /auth/link}
 *
 * @param url the outbound URL, with {@code sessionId} appended for authenticated callers
 */
public record NavigationLinkResponse(@JsonProperty("url") String url) {
}
