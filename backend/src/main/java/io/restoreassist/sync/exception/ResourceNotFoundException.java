package io.restoreassist.sync.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id);
    getBody().setProperty("resource", resourceType);
    getBody().setProperty("id", String.valueOf(id));
  }
}
