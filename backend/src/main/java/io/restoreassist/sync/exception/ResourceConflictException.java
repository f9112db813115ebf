package io.restoreassist.sync.exception;

import org.springframework.http.HttpStatus;

/** 409 for requests that collide with work already accepted for the same resource. */
public class ResourceConflictException extends ProblemException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, title, detail);
  }
}
