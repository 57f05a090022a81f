package ca.gc.cra.vlog.application;

import java.util.function.IntConsumer;

/**
 * Handle returned by {@link ValidationLogger#beginScope(String)}.
 *
 * <p>Closing the handle truncates the owner's scope stack back to the depth it had before the
 * scope was entered, which also drops nested scopes left open. Only the first {@link #close()}
 * has an effect. Intended for {@code try}-with-resources.</p>
 *
 * <p>Not thread-safe; owned by the same thread as the logger.</p> *
 * @since 0.1.0
 */
public final class ValidationScope implements AutoCloseable {
  private final IntConsumer endScope;
  private int depth;

  ValidationScope(IntConsumer endScope, int depth) {
    this.endScope = endScope;
    this.depth = depth;
  }

  /**
   * Returns the stack depth this scope was opened at, or {@code 0} once closed.
   *
   * @return 1-based depth of the scope while open
   */
  public int depth() {
    return depth;
  }

  /**
   * Indicates whether {@link #close()} has already run.
   *
   * @return {@code true} after the first close
   */
  public boolean isClosed() {
    return depth <= 0;
  }

  /** Leaves the scope; repeated calls are no-ops. */
  @Override
  public void close() {
    if (depth <= 0) {
      return;
    }
    endScope.accept(depth);
    depth = 0;
  }
}
