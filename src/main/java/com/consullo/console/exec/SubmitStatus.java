package com.consullo.console.exec;

/**
 * Immediate answer of {@link ExecutionController#submit(String)}.
 *
 * @since 1.0
 */
public enum SubmitStatus {
  /** More input is required; nothing was run. */
  INCOMPLETE,
  /** The source was handed to the worker context. */
  DISPATCHED
}
