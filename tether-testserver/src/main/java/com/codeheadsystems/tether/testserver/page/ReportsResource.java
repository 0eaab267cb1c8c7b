package com.codeheadsystems.tether.testserver.page;

import com.codeheadsystems.tether.dropwizard.auth.TetherPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.annotation.security.RolesAllowed;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Subscriber-only page.
 */
@Path("/reports")
@Produces(MediaType.TEXT_HTML)
public class ReportsResource {

  @GET
  @RolesAllowed("subscriber")
  public String reports(@Auth TetherPrincipal principal) {
    return "<!DOCTYPE html><html><body><h1>Reports</h1><p>Prepared for "
        + HomePageResource.escape(principal.displayName()) + ".</p></body></html>";
  }
}
