package io.intellixity.jobly.api.error;

public final class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
