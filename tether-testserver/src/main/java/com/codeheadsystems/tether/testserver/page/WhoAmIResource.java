package com.codeheadsystems.tether.testserver.page;

import com.codeheadsystems.tether.dropwizard.auth.TetherPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Protected endpoint: any signed-in user.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  public Map<String, String> whoAmI(@Auth TetherPrincipal principal) {
    return Map.of(
        "username", principal.username(),
        "displayName", principal.displayName(),
        "role", principal.role().wireName());
  }
}
