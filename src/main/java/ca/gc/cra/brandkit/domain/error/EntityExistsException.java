package ca.gc.cra.brandkit.domain.error;

/** Raised when creating a brand or template whose name is already taken. */
public final class EntityExistsException extends RegistryException {
  /**
   * Creates the exception.
   *
   * @param entityName conflicting entity
   * @param message human-readable reason
   */
  public EntityExistsException(String entityName, String message) {
    super(entityName, message);
  }
}
