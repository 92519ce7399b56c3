package ca.gc.cra.brandkit.infrastructure.events;

import ca.gc.cra.brandkit.application.port.ProtectionEventEmitter;
import ca.gc.cra.brandkit.domain.brand.ProtectionEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory emitter used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryProtectionEventEmitter implements ProtectionEventEmitter {
  private final CopyOnWriteArrayList<ProtectionEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void emit(ProtectionEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of emitted events.
   *
   * @return immutable list of events
   */
  public List<ProtectionEvent> snapshot() {
    return List.copyOf(events);
  }

  /** Clears the captured events. */
  public void clear() {
    events.clear();
  }
}
