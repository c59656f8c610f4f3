package com.consullo.console.loop;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Foreground task queue.
 *
 * <p>Anything that touches foreground-owned state (the transcript) is posted here by other threads
 * and executed by whichever thread pumps the loop. Processing may be re-entered from inside a task;
 * cooperative stream reads rely on that to keep the host responsive while waiting for input.
 *
 * @since 1.0
 */
public final class EventLoop implements Executor {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);

  private static final Runnable NO_OP = () -> { };

  private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
  private volatile boolean quitting;

  /**
   * Enqueues a task. May be called from any thread.
   *
   * @param task task to run on the foreground
   */
  @Override
  public void execute(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    this.queue.add(task);
  }

  /**
   * Posts a no-op so that a thread waiting in {@link #processEvents(Duration)} re-checks its
   * condition.
   */
  public void wakeUp() {
    this.queue.add(NO_OP);
  }

  /**
   * Runs the tasks queued at call time without waiting.
   *
   * @return number of tasks run
   */
  public int processPendingEvents() {
    int count = 0;
    for (int pending = this.queue.size(); pending > 0; pending--) {
      final Runnable task = this.queue.poll();
      if (task == null) {
        break;
      }
      runTask(task);
      count++;
    }
    return count;
  }

  /**
   * Waits for a task, runs it and then every other queued task.
   *
   * @param maxWait maximum wait for the first task, {@code null} to wait indefinitely
   * @return number of tasks run, 0 if the wait elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  public int processEvents(final Duration maxWait) throws InterruptedException {
    final Runnable first = maxWait == null
        ? this.queue.take()
        : this.queue.poll(maxWait.toNanos(), TimeUnit.NANOSECONDS);
    if (first == null) {
      return 0;
    }
    runTask(first);
    return 1 + processPendingEvents();
  }

  /**
   * Pumps the loop until {@code condition} holds or {@code timeout} elapses.
   *
   * @param condition stop condition, evaluated between tasks
   * @param timeout upper bound for the whole call
   * @return true if the condition held, false on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean processEventsUntil(final BooleanSupplier condition, final Duration timeout)
      throws InterruptedException {
    Validate.notNull(condition, "condition must not be null");
    Validate.notNull(timeout, "timeout must not be null");
    final long deadline = System.nanoTime() + timeout.toNanos();
    processPendingEvents();
    while (!condition.getAsBoolean()) {
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      processEvents(Duration.ofNanos(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(50))));
    }
    return true;
  }

  /**
   * Dispatches tasks on the calling thread until {@link #quit()} is called.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void run() throws InterruptedException {
    this.quitting = false;
    LOGGER.debug("Event loop started on {}", Thread.currentThread().getName());
    while (!this.quitting) {
      processEvents(null);
    }
    LOGGER.debug("Event loop stopped");
  }

  /**
   * Stops a running {@link #run()} loop after the current task.
   */
  public void quit() {
    this.quitting = true;
    wakeUp();
  }

  public int pendingCount() {
    return this.queue.size();
  }

  private static void runTask(final Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      LOGGER.error("Event loop task failed: {}", e.getMessage(), e);
    }
  }
}
