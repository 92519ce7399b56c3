package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.domain.brand.ProtectionLevel;

/**
 * Protection state of a brand as reported by {@link BrandRegistry#protectionStatus(String)}.
 *
 * @param name brand name
 * @param isProtected stored protection flag
 * @param level effective level
 * @param protectedBy actor that applied the lock; {@code null} when unprotected
 * @param protectedAt lock timestamp; {@code null} when unprotected
 * @param reason lock reason
 * @param canUpdate whether an unforced update would proceed
 * @param canDelete whether an unforced delete would proceed
 */
public record ProtectionStatus(
    String name,
    boolean isProtected,
    ProtectionLevel level,
    String protectedBy,
    String protectedAt,
    String reason,
    boolean canUpdate,
    boolean canDelete) {}
