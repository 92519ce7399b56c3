package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.port.ProtectionEventEmitter;
import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import ca.gc.cra.brandkit.domain.brand.BrandProtection;
import ca.gc.cra.brandkit.domain.brand.ProtectionEvent;
import ca.gc.cra.brandkit.domain.error.ProtectionViolationException;
import ca.gc.cra.brandkit.domain.error.RegistryException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Consults a brand's stored protection state before a guarded mutation.
 * <p><strong>Why:</strong> Strictly protected brands must not change unless an operator explicitly forces
 * the operation; warn-level brands change but leave an auditable trail.</p>
 * <p><strong>Behaviour:</strong>
 * <ul>
 *   <li>{@code none}: allowed.</li>
 *   <li>{@code warn}: allowed; a {@link ProtectionEvent} is emitted and a warning returned to the caller.</li>
 *   <li>{@code strict}: {@link ProtectionViolationException}.</li>
 *   <li>Unreadable protection state: {@link ProtectionViolationException} (fail closed).</li>
 * </ul>
 * A forced operation never calls the guard.</p>
 * <p><strong>Observability:</strong> Increments {@code brand.protection.blocked} on every refusal.</p>
 *
 * @since 0.1.0
 */
public final class ProtectionGuard {
  private static final Logger log = LoggerFactory.getLogger(ProtectionGuard.class);

  private final BrandLayout layout;
  private final ConfigStore store;
  private final ProtectionEventEmitter events;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a guard reading protection state through {@code store}.
   *
   * @param layout registry layout
   * @param store document store
   * @param events sink for warn-level events
   * @param metrics metrics sink
   * @param clock event timestamp source
   */
  public ProtectionGuard(
      BrandLayout layout,
      ConfigStore store,
      ProtectionEventEmitter events,
      MetricsPort metrics,
      ClockPort clock) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.store = Objects.requireNonNull(store, "store");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Checks whether {@code operation} may proceed on {@code name}.
   *
   * @param name brand name
   * @param operation operation verb used in messages, e.g. {@code update}
   * @return warning text when the brand is warn-protected, otherwise empty
   * @throws ProtectionViolationException if the brand is strictly protected or its state cannot be read
   */
  public Optional<String> check(String name, String operation) {
    Path document = layout.document(name);
    BrandProtection protection;
    try {
      Map<String, Object> stored = store.load(document);
      protection = BrandDocuments.protection(name, stored);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    } catch (IOException | RegistryException ex) {
      metrics.increment("brand.protection.blocked");
      log.error("Protection check failed for brand '{}' during {}", name, operation, ex);
      throw new ProtectionViolationException(name, operation,
          "Unable to verify protection status for brand '" + name
              + "'. Protection check failed - operation blocked for safety.", ex);
    }

    switch (protection.effectiveLevel()) {
      case STRICT -> {
        metrics.increment("brand.protection.blocked");
        String message = "Cannot " + operation + " protected brand '" + name + "': " + protection.reason()
            + ". Protected by: " + Objects.requireNonNullElse(protection.protectedBy(), "system")
            + " on " + Objects.requireNonNullElse(protection.protectedAt(), "unknown date")
            + ". Use --force to override (admin only).";
        log.warn("Blocked {} of strictly protected brand '{}'", operation, name);
        throw new ProtectionViolationException(name, operation, message);
      }
      case WARN -> {
        ProtectionEvent event = new ProtectionEvent(
            clock.now(), name, operation, protection.level(), protection.protectedBy(), protection.reason());
        events.emit(event);
        return Optional.of("Brand '" + name + "' is protected (warn): " + event.reason()
            + ". Protected by: " + event.protectedBy());
      }
      default -> {
        return Optional.empty();
      }
    }
  }
}
