package com.consullo.console.exec;

/**
 * Scheduling model of an {@link ExecutionController}.
 *
 * @since 1.0
 */
public enum ExecutionMode {
  /** Runs inside {@code submit} on the foreground thread. */
  INLINE,
  /** Runs on a later iteration of the foreground event loop. */
  QUEUED,
  /** Runs on a dedicated worker thread owned by the controller. */
  THREADED,
  /** Runs on an executor supplied by the embedder. */
  EXECUTOR;

  /**
   * Returns true if code runs on the foreground thread, so stream reads must cooperate with the
   * event loop instead of blocking it.
   *
   * @return true for the cooperative modes
   */
  public boolean isCooperative() {
    return this == INLINE || this == QUEUED;
  }
}
