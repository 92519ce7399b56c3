package ca.gc.cra.brandkit.domain.brand;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of a mutation that proceeded past a {@code warn}-level lock.
 *
 * @param timestamp time of the check
 * @param brandName brand being mutated
 * @param operation operation such as {@code update} or {@code delete}
 * @param level level in force
 * @param protectedBy identity that applied the lock; {@code system} when unknown
 * @param reason lock reason
 * @since 0.1.0
 */
public record ProtectionEvent(
    Instant timestamp,
    String brandName,
    String operation,
    ProtectionLevel level,
    String protectedBy,
    String reason) {

  public ProtectionEvent {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    brandName = Objects.requireNonNull(brandName, "brandName");
    operation = Objects.requireNonNull(operation, "operation");
    level = Objects.requireNonNull(level, "level");
    protectedBy = protectedBy == null || protectedBy.isBlank() ? "system" : protectedBy;
    reason = reason == null ? "" : reason;
  }
}
