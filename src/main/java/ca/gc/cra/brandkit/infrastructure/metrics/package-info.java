/**
 * Metrics adapters that bridge the Brandkit {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code brand.*}, {@code asset.*} and {@code template.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric names are exported; brand names and payloads never appear as attributes.</p>
 */
package ca.gc.cra.brandkit.infrastructure.metrics;
