package com.consullo.console.exec;

import com.consullo.console.loop.EventLoop;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative controller: code runs on the foreground thread, either inside {@link #submit(String)}
 * ({@link ExecutionMode#INLINE}) or on a later event loop iteration ({@link ExecutionMode#QUEUED}).
 *
 * <p>Nothing yields control mid-statement in this model, so running code cannot be interrupted and
 * {@link #cancel()} never delivers. All methods must be called on the foreground thread.
 *
 * @since 1.0
 */
public final class ForegroundExecutionController implements ExecutionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ForegroundExecutionController.class);

  private final ExecutionMode mode;
  private final Interpreter interpreter;
  private final EventLoop loop;
  private final ExecutionListener listener;

  private Execution current;
  private boolean exited;

  public ForegroundExecutionController(
      final ExecutionMode mode,
      final Interpreter interpreter,
      final EventLoop loop,
      final ExecutionListener listener) {
    Validate.notNull(mode, "mode must not be null");
    Validate.isTrue(mode.isCooperative(), "mode must be INLINE or QUEUED: %s", mode);
    Validate.notNull(interpreter, "interpreter must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(listener, "listener must not be null");
    this.mode = mode;
    this.interpreter = interpreter;
    this.loop = loop;
    this.listener = listener;
  }

  @Override
  public ExecutionMode mode() {
    return this.mode;
  }

  @Override
  public SubmitStatus submit(final String source) {
    Validate.notNull(source, "source must not be null");
    Validate.validState(!this.exited, "controller has exited");
    Validate.validState(this.current == null, "execution already in progress");

    if (!this.interpreter.isCompilableUnit(source)) {
      return SubmitStatus.INCOMPLETE;
    }

    final Execution execution = new Execution(source);
    this.current = execution;
    LOGGER.debug("Dispatching {} ({})", execution, this.mode);
    if (this.mode == ExecutionMode.INLINE) {
      run(execution);
    } else {
      this.loop.execute(() -> run(execution));
    }
    return SubmitStatus.DISPATCHED;
  }

  @Override
  public boolean isRunning() {
    return this.current != null;
  }

  @Override
  public boolean cancel() {
    if (this.current != null) {
      LOGGER.debug("Cannot interrupt {} in {} mode", this.current, this.mode);
    }
    return false;
  }

  @Override
  public void exit() {
    if (this.exited) {
      return;
    }
    this.exited = true;
    if (this.current != null) {
      // a queued execution that has not started yet stops at its first safe point
      this.current.requestCancel();
    }
    LOGGER.debug("Foreground controller exited");
  }

  private void run(final Execution execution) {
    execution.attach(Thread.currentThread());
    ExecutionResult result = null;
    try {
      result = this.interpreter.execute(execution);
    } finally {
      execution.finish();
      if (this.current == execution) {
        this.current = null;
      }
      final ExecutionResult delivered = result == null ? ExecutionResult.failed() : result;
      this.loop.execute(() -> this.listener.onFinished(delivered));
    }
  }
}
