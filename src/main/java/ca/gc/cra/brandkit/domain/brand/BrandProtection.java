package ca.gc.cra.brandkit.domain.brand;

import java.util.Objects;

/**
 * Protection sub-record stored as top-level document keys.
 *
 * @param isProtected whether a lock is in force
 * @param level configured level; never {@code null}
 * @param protectedBy identity that applied the lock; may be {@code null}
 * @param protectedAt ISO-8601 time the lock was applied; may be {@code null}
 * @param reason operator-supplied reason; never {@code null}, may be empty
 * @since 0.1.0
 */
public record BrandProtection(
    boolean isProtected,
    ProtectionLevel level,
    String protectedBy,
    String protectedAt,
    String reason) {

  /** Unprotected state written on create and by unlock. */
  public static final BrandProtection NONE = new BrandProtection(false, ProtectionLevel.NONE, null, null, "");

  public BrandProtection {
    level = Objects.requireNonNull(level, "level");
    reason = reason == null ? "" : reason;
  }

  /**
   * Returns the level actually enforced: {@link ProtectionLevel#NONE} whenever the lock flag is off.
   *
   * @return enforced level
   */
  public ProtectionLevel effectiveLevel() {
    return isProtected ? level : ProtectionLevel.NONE;
  }
}
