package com.codeheadsystems.tether.dropwizard;

import com.codeheadsystems.tether.server.store.StoreUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders an unreachable credential or session store as 503, so no page renders with an
 * unknown identity.
 */
public class StoreUnavailableExceptionMapper implements ExceptionMapper<StoreUnavailableException> {

  private static final Logger log = LoggerFactory.getLogger(StoreUnavailableExceptionMapper.class);

  static final String MESSAGE = "authentication subsystem unavailable";

  @Override
  public Response toResponse(StoreUnavailableException exception) {
    log.error("Authentication store unavailable", exception);
    return Response.status(Response.Status.SERVICE_UNAVAILABLE)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(Map.of("message", MESSAGE))
        .build();
  }
}
