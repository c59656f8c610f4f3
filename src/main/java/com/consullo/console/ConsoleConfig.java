package com.consullo.console;

import com.consullo.console.exec.ExecutionMode;
import org.apache.commons.lang3.Validate;

/**
 * Console configuration values.
 *
 * @param executionMode how submitted code runs; {@link ExecutionMode#EXECUTOR} is only reachable
 * through {@link Console#configureExecutor(java.util.concurrent.Executor)}
 * @param tabWidth spaces per indentation block
 * @param inputPrompt first-line input prompt, formatted with the execution counter
 * @param continuationPrompt prompt for every input line after the first
 * @param outputPrompt prompt of value records, formatted with the execution counter
 * @param instructionThreshold interpreted instructions between cancellation checks
 * @param completionEnabled whether the interpreter offers completion
 * @param ctrlDExits whether end of input on an empty buffer exits the console
 * @since 1.0
 */
public record ConsoleConfig(
    ExecutionMode executionMode,
    int tabWidth,
    String inputPrompt,
    String continuationPrompt,
    String outputPrompt,
    int instructionThreshold,
    boolean completionEnabled,
    boolean ctrlDExits) {

  public ConsoleConfig {
    Validate.notNull(executionMode, "executionMode must not be null");
    Validate.isTrue(executionMode != ExecutionMode.EXECUTOR,
        "EXECUTOR mode needs an executor, use Console.configureExecutor(Executor)");
    Validate.isTrue(tabWidth > 0, "tabWidth must be positive: %d", tabWidth);
    Validate.notNull(inputPrompt, "inputPrompt must not be null");
    Validate.notNull(continuationPrompt, "continuationPrompt must not be null");
    Validate.notNull(outputPrompt, "outputPrompt must not be null");
    Validate.isTrue(instructionThreshold > 0, "instructionThreshold must be positive: %d",
        instructionThreshold);
  }

  public static ConsoleConfig defaults() {
    return new ConsoleConfig(ExecutionMode.THREADED, 4, "IN [%d]: ", "...: ", "OUT[%d]: ",
        10_000, true, false);
  }

  public ConsoleConfig withExecutionMode(final ExecutionMode mode) {
    return new ConsoleConfig(mode, this.tabWidth, this.inputPrompt, this.continuationPrompt,
        this.outputPrompt, this.instructionThreshold, this.completionEnabled,
        this.ctrlDExits);
  }

  public ConsoleConfig withTabWidth(final int width) {
    return new ConsoleConfig(this.executionMode, width, this.inputPrompt, this.continuationPrompt,
        this.outputPrompt, this.instructionThreshold, this.completionEnabled,
        this.ctrlDExits);
  }

  public ConsoleConfig withPrompts(final String input, final String continuation, final String output) {
    return new ConsoleConfig(this.executionMode, this.tabWidth, input, continuation, output,
        this.instructionThreshold, this.completionEnabled,
        this.ctrlDExits);
  }

  public ConsoleConfig withInstructionThreshold(final int threshold) {
    return new ConsoleConfig(this.executionMode, this.tabWidth, this.inputPrompt,
        this.continuationPrompt, this.outputPrompt, threshold, this.completionEnabled, this.ctrlDExits);
  }

  public ConsoleConfig withCompletionEnabled(final boolean enabled) {
    return new ConsoleConfig(this.executionMode, this.tabWidth, this.inputPrompt,
        this.continuationPrompt, this.outputPrompt, this.instructionThreshold, enabled, this.ctrlDExits);
  }

  public ConsoleConfig withCtrlDExits(final boolean exits) {
    return new ConsoleConfig(this.executionMode, this.tabWidth, this.inputPrompt,
        this.continuationPrompt, this.outputPrompt, this.instructionThreshold, this.completionEnabled,
        exits);
  }

  /**
   * Formats the first-line input prompt for execution number {@code n}.
   *
   * @param n execution counter
   * @return prompt text
   */
  public String formatInputPrompt(final int n) {
    return String.format(this.inputPrompt, n);
  }

  public String formatOutputPrompt(final int n) {
    return String.format(this.outputPrompt, n);
  }
}
