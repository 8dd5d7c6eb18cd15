package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import java.time.Duration;
import java.util.Optional;

/**
 * A running action that stops when the scope is closed. Intended for use with try-with-resources,
 * so that the action is stopped however the block exits:
 *
 * <pre>
 * try (ActionScope scope = profiler.profile("load training data")) {
 *   // load training data
 * }
 * </pre>
 *
 * Closing the scope more than once stops the action only the first time.
 */
public final class ActionScope implements AutoCloseable {
  private final ActionProfiler profiler;
  private final String actionName;
  private boolean closed = false;
  private Duration elapsed = null;

  ActionScope(ActionProfiler profiler, String actionName) {
    this.profiler = checkNotNull(profiler);
    this.actionName = checkNotNull(actionName);
  }

  public String actionName() {
    return actionName;
  }

  /**
   * Get the elapsed time of the action, as measured when this scope was closed.
   *
   * @return The elapsed time, or empty if the scope has not been closed yet.
   */
  public Optional<Duration> elapsed() {
    return Optional.ofNullable(elapsed);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stop the action, unless this scope was already closed. The stop is attempted only once, even
   * if it fails.
   *
   * @throws UnknownActionStopException if the action was stopped by other means while this scope
   *         was open.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    elapsed = profiler.stop(actionName);
  }
}
