package com.consullo.console.exec;

/**
 * Thrown at a safe point of a cancelled execution.
 *
 * <p>This is an {@link Error} so that script-level {@code try/catch} blocks cannot swallow it.
 *
 * @since 1.0
 */
public final class ExecutionInterruptedError extends Error {

  /** Transcript marker written when an execution or pending input is interrupted. */
  public static final String MARKER = "^C";

  private static final long serialVersionUID = 1L;

  public ExecutionInterruptedError(final long executionId) {
    super("execution " + executionId + " interrupted");
  }
}
