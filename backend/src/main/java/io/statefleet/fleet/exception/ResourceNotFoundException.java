package io.statefleet.fleet.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }
}
