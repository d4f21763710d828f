package io.intellixity.jobly.api.error;

import java.util.List;

/** Client sent something the API refuses; maps to HTTP 400. */
public final class BadRequestException extends RuntimeException {
  private final List<String> errors;

  public BadRequestException(String message) {
    super(message);
    this.errors = List.of(message);
  }

  public BadRequestException(List<String> errors) {
    super(String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> errors() { return errors; }
}
