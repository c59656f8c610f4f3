package com.consullo.console.exec;

/**
 * Submit / cancel / exit protocol over a worker context.
 *
 * <p>States are {@code Idle -> Running -> Idle}. Completions reach the {@link ExecutionListener} on
 * the foreground, never on the worker thread.
 *
 * @since 1.0
 */
public interface ExecutionController {

  ExecutionMode mode();

  /**
   * Classifies {@code source} and dispatches it if complete.
   *
   * @param source accumulated source
   * @return {@link SubmitStatus#INCOMPLETE} if more input is needed, else
   *     {@link SubmitStatus#DISPATCHED}
   * @throws IllegalStateException if an execution is running or the controller has exited
   */
  SubmitStatus submit(String source);

  boolean isRunning();

  /**
   * Delivers a best-effort, asynchronous interrupt to the running execution. Does not wait for the
   * worker to stop; the interrupted execution completes later with {@code executed == false}.
   *
   * @return true if an interrupt was delivered, false if there was nothing safe to interrupt
   */
  boolean cancel();

  /**
   * Tears down the worker context. Idempotent.
   */
  void exit();
}
