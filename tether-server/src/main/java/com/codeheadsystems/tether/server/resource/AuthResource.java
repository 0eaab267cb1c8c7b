package com.codeheadsystems.tether.server.resource;

import com.codeheadsystems.tether.model.auth.AccessResponse;
import com.codeheadsystems.tether.model.auth.LoginRequest;
import com.codeheadsystems.tether.model.auth.LoginResponse;
import com.codeheadsystems.tether.model.auth.LogoutAllResponse;
import com.codeheadsystems.tether.model.auth.RegisterRequest;
import com.codeheadsystems.tether.model.auth.RegisterResponse;
import com.codeheadsystems.tether.model.auth.UserProfileResponse;
import com.codeheadsystems.tether.model.navigation.NavigationLinkResponse;
import com.codeheadsystems.tether.server.manager.AuthService;
import com.codeheadsystems.tether.server.model.LoginResult;
import com.codeheadsystems.tether.server.model.RegistrationResult;
import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.UserProfile;
import com.codeheadsystems.tether.server.session.PageRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing {@link AuthService} to browser front ends.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/login}: check credentials and start a session</li>
 *   <li>{@code POST /auth/logout}: end the current session</li>
 *   <li>{@code POST /auth/logout-all}: end every session of the current user</li>
 *   <li>{@code POST /auth/register}: self-service registration</li>
 *   <li>{@code GET /auth/me}: the resolved identity</li>
 *   <li>{@code GET /auth/access?level=}: entitlement check</li>
 *   <li>{@code GET /auth/link?url=}: a link to a sibling front end carrying the session</li>
 * </ul>
 * The identity has already been resolved by the framework's request filter, which publishes the
 * {@link PageRequest} as a request property.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AuthService authService;

  public AuthResource(AuthService authService) {
    this.authService = authService;
  }

  @POST
  @Path("/login")
  public Response login(@Context ContainerRequestContext context, LoginRequest req) {
    log.debug("login()");
    if (req == null) {
      throw new WebApplicationException("Missing login body", Response.Status.BAD_REQUEST);
    }
    LoginResult result = authService.login(pageRequest(context), req.username(), req.password());
    Response.Status status = result.success() ? Response.Status.OK : Response.Status.UNAUTHORIZED;
    return Response.status(status).entity(new LoginResponse(result.success(), result.message())).build();
  }

  @POST
  @Path("/logout")
  public Response logout(@Context ContainerRequestContext context) {
    log.debug("logout()");
    authService.logout(pageRequest(context));
    return Response.noContent().build();
  }

  @POST
  @Path("/logout-all")
  public LogoutAllResponse logoutAll(@Context ContainerRequestContext context) {
    log.debug("logoutAll()");
    return new LogoutAllResponse(authService.logoutEverywhere(pageRequest(context)));
  }

  /**
   * Registers a new user. Only the public and user roles may be self-assigned; higher roles are
   * granted by editing the credential file.
   */
  @POST
  @Path("/register")
  public Response register(RegisterRequest req) {
    log.debug("register()");
    if (req == null) {
      throw new WebApplicationException("Missing registration body", Response.Status.BAD_REQUEST);
    }
    String role = req.role() == null ? Role.USER.wireName() : req.role();
    boolean selfAssignable = Role.fromName(role).map(r -> !r.includes(Role.SUBSCRIBER)).orElse(true);
    RegistrationResult result = selfAssignable
        ? authService.register(req.username(), req.password(), req.email(), req.displayName(), role)
        : RegistrationResult.failed(RegistrationResult.Failure.INVALID_INPUT);
    if (result.success()) {
      return Response.status(Response.Status.CREATED)
          .entity(new RegisterResponse(true, null, "Registration successful"))
          .build();
    }
    RegistrationResult.Failure failure = result.failure();
    Response.Status status = failure == RegistrationResult.Failure.INVALID_INPUT
        ? Response.Status.BAD_REQUEST
        : Response.Status.CONFLICT;
    return Response.status(status)
        .entity(new RegisterResponse(false, failure.name(), failure.message()))
        .build();
  }

  @GET
  @Path("/me")
  public UserProfileResponse me(@Context ContainerRequestContext context) {
    return authService.currentUser(pageRequest(context))
        .map(AuthResource::toResponse)
        .orElseGet(UserProfileResponse::anonymous);
  }

  @GET
  @Path("/access")
  public AccessResponse access(@Context ContainerRequestContext context,
                               @QueryParam("level") String level) {
    if (level == null || level.isBlank()) {
      throw new WebApplicationException("Missing level", Response.Status.BAD_REQUEST);
    }
    return new AccessResponse(level, authService.hasAccess(pageRequest(context), level));
  }

  @GET
  @Path("/link")
  public NavigationLinkResponse link(@Context ContainerRequestContext context,
                                     @QueryParam("url") String url) {
    if (url == null || url.isBlank()) {
      throw new WebApplicationException("Missing url", Response.Status.BAD_REQUEST);
    }
    return new NavigationLinkResponse(authService.embedInLink(pageRequest(context), url));
  }

  public static PageRequest pageRequest(ContainerRequestContext context) {
    Object property = context.getProperty(PageRequest.PROPERTY);
    if (property instanceof PageRequest pageRequest) {
      return pageRequest;
    }
    log.error("No PageRequest on the request; is the session resolution filter registered?");
    throw new WebApplicationException("Identity was not resolved", Response.Status.INTERNAL_SERVER_ERROR);
  }

  static UserProfileResponse toResponse(UserProfile profile) {
    return new UserProfileResponse(true,
        profile.username(),
        profile.displayName(),
        profile.email(),
        profile.role().wireName(),
        profile.subscriptionTier().wireName(),
        profile.subscriptionStatus().wireName());
  }
}
