package ca.gc.cra.brandkit.domain.error;

/**
 * Base class for every failure raised by the brand, template and asset registries.
 *
 * <p>Each instance names the entity it concerns so callers can surface the message directly.</p>
 *
 * @since 0.1.0
 */
public abstract class RegistryException extends RuntimeException {
  private final String entityName;

  /**
   * Creates an exception for {@code entityName}.
   *
   * @param entityName brand, template or asset the failure concerns; may be {@code null} when unknown
   * @param message human-readable reason
   */
  protected RegistryException(String entityName, String message) {
    super(message);
    this.entityName = entityName;
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param entityName brand, template or asset the failure concerns
   * @param message human-readable reason
   * @param cause root cause
   */
  protected RegistryException(String entityName, String message, Throwable cause) {
    super(message, cause);
    this.entityName = entityName;
  }

  /**
   * Returns the entity this failure concerns.
   *
   * @return entity name, or {@code null} when not applicable
   */
  public String entityName() {
    return entityName;
  }
}
