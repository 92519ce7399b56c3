/**
 * Failure taxonomy shared by the brand, template and asset registries.
 * <p>All types are unchecked and carry the affected entity name. Invalid caller arguments, such as a delete
 * without confirmation, use {@link java.lang.IllegalArgumentException} instead.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.domain.error;
