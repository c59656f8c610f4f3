package com.consullo.console.exec;

import java.util.Optional;

/**
 * Outcome of one execution. Printed output never travels here; it goes through the stdout stream.
 *
 * @param executed true if the source ran to completion without an error
 * @param value display form of the result, {@code null} when there is none
 * @since 1.0
 */
public record ExecutionResult(boolean executed, String value) {

  public static ExecutionResult completed(final String value) {
    return new ExecutionResult(true, value);
  }

  public static ExecutionResult failed() {
    return new ExecutionResult(false, null);
  }

  public Optional<String> displayValue() {
    return Optional.ofNullable(this.value);
  }
}
