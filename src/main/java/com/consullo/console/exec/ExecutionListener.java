package com.consullo.console.exec;

/**
 * Receives execution completions. Always invoked on the foreground.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ExecutionListener {

  void onFinished(ExecutionResult result);
}
