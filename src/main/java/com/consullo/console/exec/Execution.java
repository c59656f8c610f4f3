package com.consullo.console.exec;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.Validate;

/**
 * One submitted unit of source and its cancellation state.
 *
 * <p>Cancellation is cooperative: {@link #requestCancel()} only raises a flag, and the running
 * code observes it the next time it reaches {@link #checkpoint()}. Each execution carries its own
 * flag, so a late cancel can never leak into a later execution.
 *
 * @since 1.0
 */
public final class Execution {

  private static final AtomicLong IDS = new AtomicLong();

  private final long id;
  private final String source;
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  private volatile Thread thread;
  private volatile boolean finished;

  public Execution(final String source) {
    Validate.notNull(source, "source must not be null");
    this.id = IDS.incrementAndGet();
    this.source = source;
  }

  public long id() {
    return this.id;
  }

  public String source() {
    return this.source;
  }

  /**
   * Records the thread that runs this execution.
   *
   * @param runner executing thread
   */
  public void attach(final Thread runner) {
    this.thread = runner;
  }

  public void requestCancel() {
    this.cancelRequested.set(true);
  }

  public boolean isCancelRequested() {
    return this.cancelRequested.get();
  }

  public void finish() {
    this.finished = true;
  }

  public boolean isFinished() {
    return this.finished;
  }

  /**
   * Safe point: throws if cancellation was requested or the executing thread was interrupted.
   *
   * @throws ExecutionInterruptedError if the execution must stop
   */
  public void checkpoint() {
    if (this.cancelRequested.get()) {
      throw new ExecutionInterruptedError(this.id);
    }
    final Thread runner = this.thread;
    if (runner != null && runner == Thread.currentThread() && runner.isInterrupted()) {
      throw new ExecutionInterruptedError(this.id);
    }
  }

  @Override
  public String toString() {
    return "Execution[" + this.id + "]";
  }
}
