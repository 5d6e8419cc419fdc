package com.splitttr.wiki.rest;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.splitttr.wiki.service.VersioningService;
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
  public static class NotFoundMapper implements ExceptionMapper<VersioningService.NotFoundException> {
    @Override
    public Response toResponse(VersioningService.NotFoundException e) {
      String msg = e.getMessage();
      if (msg == null || msg.isBlank()) msg = "not_found";
      return json(404, msg);
    }
  }

  @Provider
  public static class ConflictMapper implements ExceptionMapper<VersioningService.ConflictException> {
    @Override
    public Response toResponse(VersioningService.ConflictException e) {
      return json(409, e.getMessage());
    }
  }

  @Provider
  public static class BadRequestMapper implements ExceptionMapper<VersioningService.BadRequestException> {
    @Override
    public Response toResponse(VersioningService.BadRequestException e) {
      return json(400, e.getMessage());
    }
  }

  @Provider
  public static class ForbiddenMapper implements ExceptionMapper<VersioningService.ForbiddenException> {
    @Override
    public Response toResponse(VersioningService.ForbiddenException e) {
      return json(403, e.getMessage());
    }
  }

  @Provider
  public static class PartialFailureMapper implements ExceptionMapper<VersioningService.PartialFailureException> {
    @Override
    public Response toResponse(VersioningService.PartialFailureException e) {
      return json(500, e.getMessage());
    }
  }

  // Unique index on (title, branch) caught a concurrent insert.
  @Provider
  public static class DuplicateKeyMapper implements ExceptionMapper<MongoWriteException> {
    @Override
    public Response toResponse(MongoWriteException e) {
      if (ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY) {
        return json(409, "already_exists");
      }
      LOG.error("MongoDB write failed", e);
      return json(500, "storage_error");
    }
  }

  @Provider
  public static class StorageTimeoutMapper implements ExceptionMapper<MongoTimeoutException> {
    @Override
    public Response toResponse(MongoTimeoutException e) {
      LOG.warnf("MongoDB unavailable: %s", e.getMessage());
      return json(503, "storage_unavailable");
    }
  }

  @Provider
  public static class StorageSocketMapper implements ExceptionMapper<MongoSocketException> {
    @Override
    public Response toResponse(MongoSocketException e) {
      LOG.warnf("MongoDB unavailable: %s", e.getMessage());
      return json(503, "storage_unavailable");
    }
  }
}
