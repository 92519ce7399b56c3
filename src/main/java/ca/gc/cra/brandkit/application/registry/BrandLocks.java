package ca.gc.cra.brandkit.application.registry;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mutex per brand name so that mutating operations on the same brand run one at a time.
 *
 * <p>Locks are reentrant, so an operation holding a brand's lock may call another guarded operation on
 * the same brand. Reads do not take locks.</p>
 *
 * @since 0.1.0
 */
public final class BrandLocks {
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Blocks until the lock for {@code name} is held.
   *
   * @param name brand name
   * @return handle releasing the lock on close
   */
  public Held lock(String name) {
    ReentrantLock lock = locks.computeIfAbsent(Objects.requireNonNull(name, "name"), key -> new ReentrantLock());
    lock.lock();
    return new Held(lock);
  }

  /** Releases a brand lock on close. */
  public static final class Held implements AutoCloseable {
    private final ReentrantLock lock;

    private Held(ReentrantLock lock) {
      this.lock = lock;
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
