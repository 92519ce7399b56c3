/**
 * <strong>Purpose:</strong> Ports separating the brand, template and asset registries from storage, clocks,
 * metrics and event sinks.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume paths already validated by the registries.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brandkit.application.port;
