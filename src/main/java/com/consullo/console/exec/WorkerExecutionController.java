package com.consullo.console.exec;

import com.consullo.console.stream.Stream;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller that runs code off the foreground thread.
 *
 * <p>In {@link ExecutionMode#THREADED} mode it lazily starts, and owns, a single daemon worker
 * thread. In {@link ExecutionMode#EXECUTOR} mode it runs on an executor supplied by the embedder and
 * never shuts it down.
 *
 * <p>Cancellation is best-effort. {@link #cancel()} re-reads the current execution and compares it
 * by identity right before raising its flag, then wakes stdin in case the worker is blocked on a
 * read. The worker may still finish between that check and the flag being raised; the flag then
 * lands on a finished execution and has no effect.
 *
 * @since 1.0
 */
public final class WorkerExecutionController implements ExecutionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerExecutionController.class);

  private final ExecutionMode mode;
  private final Interpreter interpreter;
  private final Stream stdin;
  private final Executor foreground;
  private final ExecutionListener listener;
  private final Supplier<ExecutorService> workerFactory;

  private final AtomicReference<Execution> current = new AtomicReference<>();
  private final AtomicBoolean exited = new AtomicBoolean();

  private Executor executor;
  private ExecutorService ownedExecutor;

  private WorkerExecutionController(
      final ExecutionMode mode,
      final Executor executor,
      final Supplier<ExecutorService> workerFactory,
      final Interpreter interpreter,
      final Stream stdin,
      final Executor foreground,
      final ExecutionListener listener) {
    Validate.notNull(interpreter, "interpreter must not be null");
    Validate.notNull(stdin, "stdin must not be null");
    Validate.notNull(foreground, "foreground must not be null");
    Validate.notNull(listener, "listener must not be null");
    this.mode = mode;
    this.executor = executor;
    this.workerFactory = workerFactory;
    this.interpreter = interpreter;
    this.stdin = stdin;
    this.foreground = foreground;
    this.listener = listener;
  }

  /**
   * Creates a controller with a dedicated worker thread, started on first submission.
   *
   * @param interpreter worker context
   * @param stdin stream the worker reads from
   * @param foreground executor that delivers completions on the foreground
   * @param listener completion listener
   * @return threaded controller
   */
  public static WorkerExecutionController threaded(
      final Interpreter interpreter,
      final Stream stdin,
      final Executor foreground,
      final ExecutionListener listener) {
    return new WorkerExecutionController(ExecutionMode.THREADED, null,
        WorkerExecutionController::newWorker, interpreter, stdin, foreground, listener);
  }

  /**
   * Creates a controller that runs executions on {@code executor}.
   *
   * @param executor embedder-owned executor
   * @param interpreter worker context
   * @param stdin stream the worker reads from
   * @param foreground executor that delivers completions on the foreground
   * @param listener completion listener
   * @return executor-driven controller
   */
  public static WorkerExecutionController external(
      final Executor executor,
      final Interpreter interpreter,
      final Stream stdin,
      final Executor foreground,
      final ExecutionListener listener) {
    Validate.notNull(executor, "executor must not be null");
    return new WorkerExecutionController(ExecutionMode.EXECUTOR, executor, null,
        interpreter, stdin, foreground, listener);
  }

  @Override
  public ExecutionMode mode() {
    return this.mode;
  }

  @Override
  public SubmitStatus submit(final String source) {
    Validate.notNull(source, "source must not be null");
    Validate.validState(!this.exited.get(), "controller has exited");
    Validate.validState(this.current.get() == null, "execution already in progress");

    if (!this.interpreter.isCompilableUnit(source)) {
      return SubmitStatus.INCOMPLETE;
    }

    final Execution execution = new Execution(source);
    this.current.set(execution);
    try {
      workerExecutor().execute(() -> runOnWorker(execution));
    } catch (RejectedExecutionException e) {
      this.current.compareAndSet(execution, null);
      throw new IllegalStateException("worker rejected " + execution, e);
    }
    LOGGER.debug("Dispatched {} ({})", execution, this.mode);
    return SubmitStatus.DISPATCHED;
  }

  @Override
  public boolean isRunning() {
    return this.current.get() != null;
  }

  @Override
  public boolean cancel() {
    final Execution target = this.current.get();
    if (target == null) {
      LOGGER.debug("Cancel ignored: nothing running");
      return false;
    }
    if (this.current.get() != target || target.isFinished()) {
      LOGGER.debug("Cancel ignored: {} is no longer running", target);
      return false;
    }
    target.requestCancel();
    this.stdin.wake();
    LOGGER.debug("Cancel delivered to {}", target);
    return true;
  }

  @Override
  public void exit() {
    if (!this.exited.compareAndSet(false, true)) {
      return;
    }
    final Execution target = this.current.get();
    if (target != null) {
      target.requestCancel();
      this.stdin.wake();
    }
    synchronized (this) {
      if (this.ownedExecutor != null) {
        this.ownedExecutor.shutdownNow();
        this.ownedExecutor = null;
        LOGGER.debug("Worker thread shut down");
      }
    }
  }

  /**
   * Returns true once a worker executor is available, i.e. after the first threaded submission or
   * from the start in executor mode.
   *
   * @return whether a worker exists
   */
  public synchronized boolean hasWorker() {
    return this.executor != null;
  }

  private synchronized Executor workerExecutor() {
    if (this.executor == null) {
      this.ownedExecutor = this.workerFactory.get();
      this.executor = this.ownedExecutor;
      LOGGER.debug("Worker thread started");
    }
    return this.executor;
  }

  private void runOnWorker(final Execution execution) {
    execution.attach(Thread.currentThread());
    ExecutionResult result = null;
    try {
      result = this.interpreter.execute(execution);
    } finally {
      execution.finish();
      this.current.compareAndSet(execution, null);
      final ExecutionResult delivered = result == null ? ExecutionResult.failed() : result;
      this.foreground.execute(() -> this.listener.onFinished(delivered));
    }
  }

  private static ExecutorService newWorker() {
    final BasicThreadFactory factory = new BasicThreadFactory.Builder()
        .namingPattern("console-worker-%d")
        .daemon(true)
        .build();
    return Executors.newSingleThreadExecutor(factory);
  }
}
