package ca.gc.cra.brandkit.domain.error;

/** Wraps unexpected I/O failures raised while a registry operation was running. */
public final class RegistryInternalException extends RegistryException {
  public RegistryInternalException(String entityName, String message, Throwable cause) {
    super(entityName, message, cause);
  }
}
