package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when an action is stopped but no timer for that action name is running.
 */
public class UnknownActionStopException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String actionName;

  public UnknownActionStopException(String actionName) {
    super(String.format("Attempted to stop action '%s', which was never started.",
        checkNotNull(actionName)));
    this.actionName = actionName;
  }

  public String actionName() {
    return actionName;
  }
}
