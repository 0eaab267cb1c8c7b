package com.codeheadsystems.tether.testserver.page;

import com.codeheadsystems.tether.server.manager.AuthService;
import com.codeheadsystems.tether.server.model.UserProfile;
import com.codeheadsystems.tether.server.resource.AuthResource;
import com.codeheadsystems.tether.server.session.PageRequest;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Optional;

/**
 * Landing page: greets the caller and links to sibling front ends, carrying the session along.
 */
@Path("/")
@Produces(MediaType.TEXT_HTML)
public class HomePageResource {

  private final AuthService authService;
  private final List<String> siblings;

  public HomePageResource(AuthService authService, List<String> siblings) {
    this.authService = authService;
    this.siblings = List.copyOf(siblings);
  }

  @GET
  public String home(@Context ContainerRequestContext context) {
    PageRequest request = AuthResource.pageRequest(context);
    Optional<UserProfile> user = authService.currentUser(request);
    StringBuilder html = new StringBuilder("<!DOCTYPE html><html><head><title>Tether</title></head><body>");
    if (user.isPresent()) {
      html.append("<p>Signed in as ").append(escape(user.get().displayName()))
          .append(" (").append(user.get().role().wireName()).append(")</p>");
    } else {
      html.append("<p>Not signed in. POST credentials to <code>/auth/login</code>.</p>");
    }
    if (authService.hasAccess(request, "subscriber")) {
      html.append("<p><a href=\"/reports\">Subscriber reports</a></p>");
    }
    html.append("<ul>");
    for (String sibling : siblings) {
      html.append("<li><a href=\"").append(escape(authService.embedInLink(request, sibling))).append("\">")
          .append(escape(sibling)).append("</a></li>");
    }
    html.append("</ul></body></html>");
    return html.toString();
  }

  static String escape(String text) {
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }
}
