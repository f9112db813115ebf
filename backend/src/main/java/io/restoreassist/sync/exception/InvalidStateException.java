package io.restoreassist.sync.exception;

import org.springframework.http.HttpStatus;

/** The resource exists but its current state does not allow the requested change. */
public class InvalidStateException extends ProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, title, detail);
  }
}
