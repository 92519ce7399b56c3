package ca.gc.cra.brandkit.application.port;

import ca.gc.cra.brandkit.domain.brand.ProtectionEvent;

/**
 * <strong>What:</strong> Outbound port recording mutations that proceeded past a {@code warn}-level lock.
 * <p><strong>Why:</strong> Warn-level protection allows the operation but requires an auditable record naming the
 * brand, operation, protecting identity and reason.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent invocations.</p>
 *
 * @since 0.1.0
 */
public interface ProtectionEventEmitter {
  /**
   * Records a protection warning.
   *
   * @param event warning details; never {@code null}
   */
  void emit(ProtectionEvent event);

  /** Emitter that discards events. */
  ProtectionEventEmitter NO_OP = event -> {};
}
