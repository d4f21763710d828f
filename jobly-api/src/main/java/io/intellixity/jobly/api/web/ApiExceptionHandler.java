package io.intellixity.jobly.api.web;

import io.intellixity.jobly.api.error.BadRequestException;
import io.intellixity.jobly.api.error.NotFoundException;
import io.intellixity.jobly.persistence.jdbc.QueryExecutionException;
import io.intellixity.jobly.persistence.sql.NoUpdateDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders failures as {@code {"error": {"message": ..., "status": ...}}}. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> badRequest(BadRequestException e) {
    Object message = e.errors().size() == 1 ? e.errors().get(0) : e.errors();
    return error(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(NoUpdateDataException.class)
  public ResponseEntity<Map<String, Object>> noUpdateData(NoUpdateDataException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> unreadable(Exception e) {
    log.debug("jobly.bad_input type={} message={}", e.getClass().getSimpleName(), e.getMessage());
    return error(HttpStatus.BAD_REQUEST, "Malformed request");
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler(QueryExecutionException.class)
  public ResponseEntity<Map<String, Object>> database(QueryExecutionException e) {
    log.error("jobly.db_error sqlState={}", e.sqlState(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<Map<String, Object>> unexpected(RuntimeException e) {
    log.error("jobly.unhandled type={}", e.getClass().getSimpleName(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
  }

  static ResponseEntity<Map<String, Object>> error(HttpStatus status, Object message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", message instanceof List<?> l ? List.copyOf(l) : message);
    body.put("status", status.value());
    Map<String, Object> wrapped = Map.of("error", body);
    return ResponseEntity.status(status).body(wrapped);
  }
}
