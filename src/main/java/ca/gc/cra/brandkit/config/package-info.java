/**
 * Document merging, settings resolution and composition root wiring for Brandkit.
 * <p><strong>Role:</strong> Bootstrap layer selecting storage, backup, event and metrics adapters.</p>
 * <p><strong>Concurrency:</strong> Settings objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates registry roots through {@code ca.gc.cra.brandkit.validation} utilities.</p>
 */
package ca.gc.cra.brandkit.config;
