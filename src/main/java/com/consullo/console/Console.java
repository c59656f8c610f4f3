package com.consullo.console;

import com.consullo.console.complete.Completer;
import com.consullo.console.exec.ExecutionController;
import com.consullo.console.exec.ExecutionInterruptedError;
import com.consullo.console.exec.ExecutionListener;
import com.consullo.console.exec.ExecutionMode;
import com.consullo.console.exec.ExecutionResult;
import com.consullo.console.exec.ForegroundExecutionController;
import com.consullo.console.exec.Interpreter;
import com.consullo.console.exec.SubmitStatus;
import com.consullo.console.exec.WorkerExecutionController;
import com.consullo.console.log.Domain;
import com.consullo.console.log.LogRecord;
import com.consullo.console.loop.EventLoop;
import com.consullo.console.stream.Stream;
import com.consullo.console.stream.StreamListener;
import com.consullo.console.transcript.Transcript;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive console: a {@link Transcript} whose editable tail is submitted to an
 * {@link Interpreter} through an {@link ExecutionController}.
 *
 * <p>
 * The console is Idle while an input prompt waits for a submission and Running from a dispatched
 * submission until its completion is delivered. Output the interpreter writes to stdout is moved
 * into the transcript on the {@link EventLoop}, as is every completion, so the transcript is only
 * ever touched by the thread that drives the loop. All public methods must be called on that
 * thread.
 * </p>
 *
 * @since 1.0
 */
public final class Console implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Console.class);

  static final String CTRL_D_REFUSED = "Can't use CTRL-D to exit, you have to exit the application!";

  private final ConsoleConfig config;
  private final Interpreter interpreter;
  private final Stream stdin;
  private final Stream stdout;
  private final EventLoop loop;
  private final Transcript transcript;
  private final List<Consumer<String>> inputAppliedListeners = new CopyOnWriteArrayList<>();
  private final List<Runnable> exitListeners = new CopyOnWriteArrayList<>();

  private ExecutionController controller;
  private String lastInput = "";
  private int counter;
  private boolean running;
  private boolean exited;

  /**
   * Creates a console and opens its first prompt.
   *
   * @param config configuration values
   * @param interpreter worker context; must read {@code stdin} and write {@code stdout}
   * @param stdin stream that typed lines are written to while code runs
   * @param stdout stream the interpreter prints to
   * @param loop foreground event loop
   */
  public Console(
      final ConsoleConfig config,
      final Interpreter interpreter,
      final Stream stdin,
      final Stream stdout,
      final EventLoop loop) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(interpreter, "interpreter must not be null");
    Validate.notNull(stdin, "stdin must not be null");
    Validate.notNull(stdout, "stdout must not be null");
    Validate.notNull(loop, "loop must not be null");
    this.config = config;
    this.interpreter = interpreter;
    this.stdin = stdin;
    this.stdout = stdout;
    this.loop = loop;
    this.transcript = new Transcript(config.tabWidth(), config.continuationPrompt());

    this.stdout.addListener(new StreamListener() {
      @Override
      public void onWrite(final String data) {
        Console.this.loop.execute(Console.this::drainStdout);
      }
    });
    this.interpreter.setExitHandler(() -> this.loop.execute(this::exit));
    showPrompt();
  }

  public void addInputAppliedListener(final Consumer<String> listener) {
    Validate.notNull(listener, "listener must not be null");
    this.inputAppliedListeners.add(listener);
  }

  public void addExitListener(final Runnable listener) {
    Validate.notNull(listener, "listener must not be null");
    this.exitListeners.add(listener);
  }

  /**
   * Selects how submitted code runs. Allowed once, before the first submission.
   *
   * @param mode {@link ExecutionMode#INLINE}, {@link ExecutionMode#QUEUED} or
   * {@link ExecutionMode#THREADED}
   */
  public void configureExecutor(final ExecutionMode mode) {
    Validate.notNull(mode, "mode must not be null");
    Validate.isTrue(mode != ExecutionMode.EXECUTOR, "EXECUTOR mode needs an executor");
    Validate.validState(this.controller == null, "executor already configured");
    final ExecutionListener listener = this::onFinished;
    if (mode.isCooperative()) {
      this.controller = new ForegroundExecutionController(mode, this.interpreter, this.loop, listener);
    } else {
      this.controller = WorkerExecutionController.threaded(this.interpreter, this.stdin, this.loop, listener);
    }
    this.stdin.cooperateWith(mode.isCooperative() ? this.loop : null);
    LOGGER.debug("Execution mode {}", mode);
  }

  /**
   * Runs submitted code on an executor owned by the caller. Allowed once, before the first
   * submission.
   *
   * @param executor executor to run code on; it is never shut down by the console
   */
  public void configureExecutor(final Executor executor) {
    Validate.notNull(executor, "executor must not be null");
    Validate.validState(this.controller == null, "executor already configured");
    this.controller = WorkerExecutionController.external(
        executor, this.interpreter, this.stdin, this.loop, this::onFinished);
    this.stdin.cooperateWith(null);
    LOGGER.debug("Execution mode {}", ExecutionMode.EXECUTOR);
  }

  /**
   * Handles the Enter key.
   *
   * <p>
   * While code runs, the typed line is kept as an echo and written to stdin. Otherwise the input
   * buffer is submitted: an incomplete statement gets a continuation line, anything else is
   * dispatched and its input record finalized.
   * </p>
   */
  public void processInput() {
    Validate.validState(!this.exited, "console has exited");
    if (this.running) {
      if (!this.transcript.isInputOpen()) {
        this.transcript.openInput("");
      }
      final String line = this.transcript.closeInput();
      this.stdin.write(line + "\n");
      return;
    }

    final String source = this.transcript.inputBuffer();
    // classified up front so the input is final before an inline execution starts
    if (!this.interpreter.isCompilableUnit(source)) {
      this.transcript.moveCursor(this.transcript.promptEnd(), false);
      this.transcript.insertInputText("\n");
      return;
    }

    this.lastInput = source;
    this.transcript.closeInput();
    this.running = true;
    for (Consumer<String> listener : this.inputAppliedListeners) {
      listener.accept(source);
    }
    final SubmitStatus status;
    try {
      status = controller().submit(source);
    } catch (RuntimeException e) {
      this.running = false;
      showPrompt();
      throw e;
    }
    Validate.validState(status == SubmitStatus.DISPATCHED, "compilable source was not dispatched");
  }

  /**
   * Types {@code text} into the editable region. While code runs, this opens a line that
   * {@link #processInput()} sends to stdin.
   *
   * @param text text to insert at the cursor
   */
  public void insertInputText(final String text) {
    Validate.validState(!this.exited, "console has exited");
    if (!this.transcript.isInputOpen()) {
      this.transcript.openInput("");
    }
    this.transcript.insertInputText(text);
  }

  /**
   * Handles Ctrl+C. While code runs the controller is asked to interrupt it; when idle the pending
   * input is abandoned and a fresh prompt opened.
   */
  public void cancel() {
    if (this.exited) {
      return;
    }
    if (this.running) {
      final boolean delivered = controller().cancel();
      if (!delivered && this.transcript.isInputOpen()) {
        this.transcript.clearInputBuffer();
      }
      LOGGER.debug("Cancel while running, delivered={}", delivered);
      return;
    }
    this.lastInput = "";
    this.transcript.closeInput();
    this.transcript.append(Domain.CONTROL, "\n", ExecutionInterruptedError.MARKER + "\n");
    showPrompt();
  }

  /**
   * Handles Ctrl+D. On an empty idle input it either exits the console or, when
   * {@link ConsoleConfig#ctrlDExits()} is off, says so and opens a fresh prompt.
   *
   * @return true if the key was consumed; false while code runs or the input buffer has text
   */
  public boolean endOfInput() {
    if (this.exited || this.running || !this.transcript.inputBuffer().isEmpty()) {
      return false;
    }
    if (this.config.ctrlDExits()) {
      exit();
      return true;
    }
    this.lastInput = "";
    this.transcript.closeInput();
    this.transcript.append(Domain.RAW_OUTPUT, "\n", CTRL_D_REFUSED + "\n");
    showPrompt();
    return true;
  }

  /**
   * Stores {@code value} under {@code name} in the interpreter's environment. Only allowed while
   * idle, since a running execution owns the environment.
   *
   * @param name variable name
   * @param value Java value
   */
  public void pushLocal(final String name, final Object value) {
    Validate.validState(!this.running, "cannot push '%s' while code is running", name);
    this.interpreter.environment().put(name, value);
  }

  /**
   * Completes the trailing token of {@code line}.
   *
   * @param line text up to the cursor
   * @return candidates, empty when the interpreter offers no completion
   */
  public List<String> completions(final String line) {
    Validate.notNull(line, "line must not be null");
    final Optional<Completer> completer = this.interpreter.completer();
    if (completer.isEmpty()) {
      return List.of();
    }
    try {
      return completer.get().complete(line);
    } catch (RuntimeException e) {
      LOGGER.warn("Completion failed for '{}': {}", line, e.getMessage(), e);
      return List.of();
    }
  }

  public String promptText(final int line) {
    return this.transcript.promptText(line);
  }

  public Transcript transcript() {
    return this.transcript;
  }

  public EventLoop eventLoop() {
    return this.loop;
  }

  public Stream stdin() {
    return this.stdin;
  }

  public Stream stdout() {
    return this.stdout;
  }

  public boolean isRunning() {
    return this.running;
  }

  public boolean isExited() {
    return this.exited;
  }

  /**
   * Returns the number of successful non-empty submissions so far.
   *
   * @return execution counter
   */
  public int counter() {
    return this.counter;
  }

  /**
   * Stops the controller, closes both streams and notifies exit listeners. Idempotent.
   */
  public void exit() {
    if (this.exited) {
      return;
    }
    this.exited = true;
    LOGGER.debug("Console exiting (running={})", this.running);
    if (this.controller != null) {
      this.controller.exit();
    }
    drainStdout();
    this.stdin.close();
    this.stdout.close();
    for (Runnable listener : this.exitListeners) {
      listener.run();
    }
  }

  @Override
  public void close() {
    exit();
  }

  private ExecutionController controller() {
    if (this.controller == null) {
      configureExecutor(this.config.executionMode());
    }
    return this.controller;
  }

  private void onFinished(final ExecutionResult result) {
    if (this.exited) {
      LOGGER.debug("Completion after exit ignored: {}", result);
      return;
    }
    // output written just before completion must land above the value
    drainStdout();
    this.running = false;
    result.displayValue().ifPresent(value -> {
      final String text = value + "\n";
      final String prompt = this.config.formatOutputPrompt(this.counter) + "\n"
          + StringUtils.repeat('\n', StringUtils.countMatches(value, '\n'));
      this.transcript.append(Domain.OUTPUT, prompt, text);
    });
    if (result.executed() && !this.lastInput.isEmpty()) {
      this.counter++;
    }
    showPrompt();
  }

  private void showPrompt() {
    final Optional<LogRecord> last = this.transcript.lastFinalizedRecord();
    if (last.isPresent() && last.get().domain() != Domain.INPUT) {
      this.transcript.append(Domain.CONTROL, "\n", "\n");
    }
    final String prompt = this.config.formatInputPrompt(this.counter);
    if (this.transcript.isInputOpen()) {
      // text typed while the previous execution ran becomes the new input
      this.transcript.setInputPrompt(prompt);
    } else {
      this.transcript.openInput(prompt);
    }
  }

  private void drainStdout() {
    final String data = this.stdout.flush();
    if (data.isEmpty()) {
      return;
    }
    final int rows = StringUtils.countMatches(data, '\n') + (data.endsWith("\n") ? 0 : 1);
    this.transcript.append(Domain.RAW_OUTPUT, StringUtils.repeat('\n', rows), data);
  }
}
