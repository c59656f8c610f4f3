package com.consullo.console.exec;

import com.consullo.console.exec.rhino.RhinoInterpreter;
import com.consullo.console.loop.EventLoop;
import com.consullo.console.stream.Stream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link WorkerExecutionController} against a real Rhino interpreter.
 *
 * @since 1.0
 */
public class WorkerExecutionControllerTest {

  private static final Duration WAIT = Duration.ofSeconds(5);

  private final Stream stdin = new Stream("stdin");
  private final Stream stdout = new Stream("stdout");
  private final RhinoInterpreter interpreter = new RhinoInterpreter(this.stdin, this.stdout, 1_000, false);
  private final EventLoop loop = new EventLoop();
  private final List<ExecutionResult> results = new ArrayList<>();
  private WorkerExecutionController controller;

  @AfterEach
  void tearDown() {
    if (this.controller != null) {
      this.controller.exit();
    }
  }

  @Test
  @DisplayName("Should run code on a lazily started worker and deliver results on the loop")
  void submit_Threaded_RunsOnWorkerThread() throws Exception {
    final Interpreter mocked = mock(Interpreter.class);
    final AtomicReference<String> threadName = new AtomicReference<>();
    when(mocked.isCompilableUnit("1")).thenReturn(true);
    when(mocked.execute(any())).thenAnswer(invocation -> {
      threadName.set(Thread.currentThread().getName());
      return ExecutionResult.completed("1");
    });
    this.controller = WorkerExecutionController.threaded(mocked, this.stdin, this.loop, this.results::add);
    assertThat(this.controller.hasWorker()).isFalse();

    assertThat(this.controller.submit("1")).isEqualTo(SubmitStatus.DISPATCHED);

    assertThat(this.controller.hasWorker()).isTrue();
    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(threadName.get()).startsWith("console-worker-");
    assertThat(this.results).containsExactly(ExecutionResult.completed("1"));
    assertThat(this.controller.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should interrupt an infinite loop")
  void cancel_InfiniteLoop_StopsExecution() throws Exception {
    this.controller = threaded();
    this.controller.submit("while (true) {}");
    Thread.sleep(100);
    assertThat(this.controller.isRunning()).isTrue();

    assertThat(this.controller.cancel()).isTrue();

    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(this.results.get(0).executed()).isFalse();
    assertThat(this.stdout.flush()).isEqualTo("^C\n");
  }

  @Test
  @DisplayName("Should interrupt code blocked on stdin without deadlock")
  void cancel_BlockedReadline_StopsExecution() throws Exception {
    this.controller = threaded();
    this.controller.submit("var line = readline(); print('got ' + line)");
    Thread.sleep(100);

    assertThat(this.controller.cancel()).isTrue();

    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(this.results.get(0).executed()).isFalse();
    assertThat(this.stdout.flush()).isEqualTo("^C\n");
  }

  @Test
  @DisplayName("Should feed stdin lines to running code")
  void submit_ReadlineThenWrite_ReceivesLine() throws Exception {
    this.controller = threaded();
    this.controller.submit("readline().toUpperCase()");
    Thread.sleep(50);

    this.stdin.write("quiet\n");

    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(this.results).containsExactly(ExecutionResult.completed("QUIET"));
  }

  @Test
  @DisplayName("Should ignore cancel when idle and not leak it into the next execution")
  void cancel_Idle_DoesNotAffectNextExecution() throws Exception {
    this.controller = threaded();

    assertThat(this.controller.cancel()).isFalse();

    this.controller.submit("6 * 7");
    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(this.controller.cancel()).isFalse();

    this.controller.submit("'again'");
    assertThat(this.loop.processEventsUntil(() -> this.results.size() == 2, WAIT)).isTrue();
    assertThat(this.results).extracting(ExecutionResult::executed).containsExactly(true, true);
  }

  @Test
  @DisplayName("Should notify the listener once per execution")
  void submit_ListenerMock_CalledOnFinish() {
    final ExecutionListener listener = mock(ExecutionListener.class);
    this.controller = WorkerExecutionController.threaded(this.interpreter, this.stdin, Runnable::run, listener);

    this.controller.submit("'done'");

    verify(listener, timeout(5_000)).onFinished(ExecutionResult.completed("done"));
    verifyNoMoreInteractions(listener);
  }

  @Test
  @DisplayName("Should reject a second submission while one is running")
  void submit_WhileRunning_Throws() throws Exception {
    this.controller = threaded();
    this.controller.submit("readline()");

    assertThatThrownBy(() -> this.controller.submit("1")).isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("in progress");
  }

  @Test
  @DisplayName("Should stop the worker on exit and stay exited")
  void exit_Running_CancelsAndRejectsFurtherWork() throws Exception {
    this.controller = threaded();
    this.controller.submit("while (true) {}");
    Thread.sleep(50);

    this.controller.exit();
    this.controller.exit();

    assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
    assertThat(this.results.get(0).executed()).isFalse();
    assertThatThrownBy(() -> this.controller.submit("1")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should run on an external executor and leave it running after exit")
  void external_Executor_NotShutDownOnExit() throws Exception {
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      this.controller = WorkerExecutionController.external(
          executor, this.interpreter, this.stdin, this.loop, this.results::add);
      assertThat(this.controller.mode()).isEqualTo(ExecutionMode.EXECUTOR);
      assertThat(this.controller.hasWorker()).isTrue();

      this.controller.submit("1 + 2");
      assertThat(this.loop.processEventsUntil(() -> !this.results.isEmpty(), WAIT)).isTrue();
      this.controller.exit();

      assertThat(this.results).containsExactly(ExecutionResult.completed("3"));
      assertThat(executor.isShutdown()).isFalse();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should surface a rejecting executor as IllegalStateException and stay idle")
  void submit_RejectingExecutor_ThrowsAndStaysIdle() {
    this.controller = WorkerExecutionController.external(task -> {
      throw new RejectedExecutionException("full");
    }, this.interpreter, this.stdin, this.loop, this.results::add);

    assertThatThrownBy(() -> this.controller.submit("1")).isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
    assertThat(this.controller.isRunning()).isFalse();
  }

  private WorkerExecutionController threaded() {
    return WorkerExecutionController.threaded(this.interpreter, this.stdin, this.loop, this.results::add);
  }
}
