package com.consullo.console.exec.rhino;

import com.consullo.console.exec.Execution;
import org.apache.commons.lang3.Validate;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * Context factory whose contexts poll the running {@link Execution} for cancellation.
 *
 * <p>Contexts run interpreted, so the instruction observer fires on loop back-edges and calls as
 * well as straight-line code; every {@code instructionThreshold} instructions is a safe point.
 *
 * @since 1.0
 */
final class InterruptibleContextFactory extends ContextFactory {

  static final int MAX_STACK_DEPTH = 10_000;

  private final int instructionThreshold;

  InterruptibleContextFactory(final int instructionThreshold) {
    Validate.isTrue(instructionThreshold > 0, "instructionThreshold must be positive");
    this.instructionThreshold = instructionThreshold;
  }

  @Override
  protected Context makeContext() {
    final Context cx = super.makeContext();
    cx.setLanguageVersion(Context.VERSION_ES6);
    cx.setOptimizationLevel(-1);
    cx.setMaximumInterpreterStackDepth(MAX_STACK_DEPTH);
    cx.setInstructionObserverThreshold(this.instructionThreshold);
    return cx;
  }

  @Override
  protected void observeInstructionCount(final Context cx, final int instructionCount) {
    final Object execution = cx.getThreadLocal(Execution.class);
    if (execution instanceof Execution) {
      ((Execution) execution).checkpoint();
    }
  }
}
