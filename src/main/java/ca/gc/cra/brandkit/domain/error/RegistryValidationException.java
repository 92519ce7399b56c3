package ca.gc.cra.brandkit.domain.error;

/**
 * Raised for hard validation failures: malformed names, oversized or disallowed assets and malformed documents.
 */
public final class RegistryValidationException extends RegistryException {
  public RegistryValidationException(String entityName, String message) {
    super(entityName, message);
  }

  public RegistryValidationException(String entityName, String message, Throwable cause) {
    super(entityName, message, cause);
  }
}
