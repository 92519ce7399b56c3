package ca.gc.cra.brandkit.domain.error;

/** Raised when a brand, template or asset does not exist. */
public final class EntityNotFoundException extends RegistryException {
  /**
   * Creates the exception.
   *
   * @param entityName missing entity
   * @param message human-readable reason
   */
  public EntityNotFoundException(String entityName, String message) {
    super(entityName, message);
  }
}
