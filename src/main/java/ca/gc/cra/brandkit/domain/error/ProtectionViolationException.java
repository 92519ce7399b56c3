package ca.gc.cra.brandkit.domain.error;

/**
 * Raised when a brand's protection state blocks an operation, or when that state cannot be determined.
 */
public final class ProtectionViolationException extends RegistryException {
  private final String operation;

  /**
   * Creates the exception.
   *
   * @param entityName protected brand
   * @param operation blocked operation such as {@code update} or {@code delete}
   * @param message human-readable reason
   */
  public ProtectionViolationException(String entityName, String operation, String message) {
    super(entityName, message);
    this.operation = operation;
  }

  /**
   * Creates the exception for a protection check that failed to complete.
   *
   * @param entityName brand under check
   * @param operation blocked operation
   * @param message human-readable reason
   * @param cause failure that prevented the check
   */
  public ProtectionViolationException(String entityName, String operation, String message, Throwable cause) {
    super(entityName, message, cause);
    this.operation = operation;
  }

  /**
   * Returns the blocked operation.
   *
   * @return operation name
   */
  public String operation() {
    return operation;
  }
}
