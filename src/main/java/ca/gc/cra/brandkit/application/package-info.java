/**
 * Application layer of the brand registry.
 * <p><strong>Role:</strong> Hosts the brand, template and asset services and the ports they depend on.</p>
 * <p><strong>Concurrency:</strong> Services serialize mutations per brand name; reads are lock-free.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code brand.*}, {@code asset.*} and {@code template.*}.</p>
 * <p><strong>Security:</strong> Entity names and relative paths are validated before any filesystem access.</p>
 */
package ca.gc.cra.brandkit.application;
