package com.consullo.console.exec;

import com.consullo.console.complete.Completer;
import java.util.Optional;

/**
 * Worker context that classifies and runs submitted source.
 *
 * @since 1.0
 */
public interface Interpreter {

  /**
   * Returns false if {@code source} is a syntactically incomplete statement that more input could
   * complete. Any other source, including one with a syntax error, is a compilable unit.
   *
   * @param source accumulated source
   * @return true if the source can be executed as is
   */
  boolean isCompilableUnit(String source);

  /**
   * Runs the execution's source against {@link #environment()}. Errors raised by the source are
   * written to stdout and reported as {@code executed == false}; they never propagate.
   *
   * @param execution execution to run; its {@link Execution#checkpoint()} is polled while running
   * @return outcome
   */
  ExecutionResult execute(Execution execution);

  Environment environment();

  /**
   * Returns the completion capability, if this interpreter offers one.
   *
   * @return completer or empty
   */
  Optional<Completer> completer();

  /**
   * Sets the action run when executed code asks the console to exit.
   *
   * @param handler exit action, called on the executing thread
   */
  void setExitHandler(Runnable handler);
}
