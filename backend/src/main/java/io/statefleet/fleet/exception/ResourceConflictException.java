package io.statefleet.fleet.exception;

import org.springframework.http.HttpStatus;

public class ResourceConflictException extends ProblemException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, title, detail);
  }
}
