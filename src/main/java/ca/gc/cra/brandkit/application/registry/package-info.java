/**
 * Brand lifecycle: creation, updates, deletion, listing and protection.
 * <p>{@link ca.gc.cra.brandkit.application.registry.BrandRegistry} runs every mutation through
 * {@link ca.gc.cra.brandkit.application.registry.ProtectionGuard}, a backup and
 * {@link ca.gc.cra.brandkit.application.registry.VersionManager}. Lock and unlock are forced updates that
 * always name an actor.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.application.registry;
