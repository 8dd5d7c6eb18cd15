package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when an action is started while a timer for the same action name is still running.
 * Unbalanced {@code start} calls, or re-entrant timing of an action that has not been stopped yet,
 * cause this.
 */
public class DuplicateActionStartException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String actionName;

  public DuplicateActionStartException(String actionName) {
    super(String.format("Attempted to start action '%s', which has already been started.",
        checkNotNull(actionName)));
    this.actionName = actionName;
  }

  /**
   * Get the name of the action that was already running.
   *
   * @return The action name.
   */
  public String actionName() {
    return actionName;
  }
}
