package ca.gc.cra.brandkit.infrastructure.events;

import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.port.ProtectionEventEmitter;
import ca.gc.cra.brandkit.domain.brand.ProtectionEvent;
import ca.gc.cra.brandkit.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records warn-level protection events as WARN log lines and counts them.
 *
 * @since 0.1.0
 */
public final class LoggingProtectionEventEmitter implements ProtectionEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(LoggingProtectionEventEmitter.class);

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates an emitter.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix counter prefix; {@code <prefix>.warned} is incremented per event
   */
  public LoggingProtectionEventEmitter(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "brand.protection" : metricPrefix.trim();
  }

  /**
   * Creates an emitter counting under {@code brand.protection}.
   *
   * @param metrics metrics adapter
   */
  public LoggingProtectionEventEmitter(MetricsPort metrics) {
    this(metrics, "brand.protection");
  }

  @Override
  public void emit(ProtectionEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".warned");
    String reason = event.reason().isBlank() ? "Brand is marked as protected" : event.reason();
    log.warn("Attempting to {} protected brand '{}': {}. Protected by: {} (level={})",
        event.operation(),
        event.brandName(),
        Logs.truncate(reason),
        Logs.truncate(event.protectedBy()),
        event.level().value());
  }
}
