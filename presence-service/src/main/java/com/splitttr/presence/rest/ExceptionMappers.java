package com.splitttr.presence.rest;

import com.splitttr.presence.service.PresenceService;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

public class ExceptionMappers {

  private static final Logger LOG = Logger.getLogger(ExceptionMappers.class);

  public static class ErrorBody {
    public String error;
    public ErrorBody(String error) { this.error = error; }
  }

  private static Response json(int status, String message) {
    return Response.status(status).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(message)).build();
  }

  @Provider
  public static class BadRequestMapper implements ExceptionMapper<PresenceService.BadRequestException> {
    @Override
    public Response toResponse(PresenceService.BadRequestException e) {
      return json(400, e.getMessage());
    }
  }

  @Provider
  public static class DuplicateSessionMapper implements ExceptionMapper<PresenceService.DuplicateSessionException> {
    @Override
    public Response toResponse(PresenceService.DuplicateSessionException e) {
      return json(409, e.getMessage());
    }
  }

  @Provider
  public static class OfflineMapper implements ExceptionMapper<PresenceService.PresenceOfflineException> {
    @Override
    public Response toResponse(PresenceService.PresenceOfflineException e) {
      LOG.warnf("Presence storage unavailable: %s", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
      return json(503, e.getMessage());
    }
  }
}
