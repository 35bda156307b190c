package io.statefleet.fleet.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateException extends ProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, title, detail);
  }
}
