package com.consullo.console.exec.rhino;

import com.consullo.console.complete.Completer;
import com.consullo.console.complete.ScopeCompleter;
import com.consullo.console.exec.Environment;
import com.consullo.console.exec.Execution;
import com.consullo.console.exec.ExecutionInterruptedError;
import com.consullo.console.exec.ExecutionResult;
import com.consullo.console.exec.Interpreter;
import com.consullo.console.stream.Stream;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.JavaScriptException;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JavaScript worker context built on Mozilla Rhino.
 *
 * <p>The global scope is created once and shared by every evaluation, so definitions persist
 * between submissions. Besides the standard objects it provides:
 * <ul>
 * <li>{@code print(...)}: writes its arguments, space separated, plus a line break to stdout;</li>
 * <li>{@code write(text)}: writes text to stdout as is;</li>
 * <li>{@code readline()}: reads one line from stdin, {@code null} at end of input;</li>
 * <li>{@code input(prompt)}: writes the prompt, then reads like {@code readline()};</li>
 * <li>{@code exit()} / {@code quit()}: asks the console to exit.</li>
 * </ul>
 *
 * <p>A single interpreter can serve any thread, one evaluation at a time; each call enters its own
 * Rhino context on the calling thread.
 *
 * @since 1.0
 */
public final class RhinoInterpreter implements Interpreter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RhinoInterpreter.class);

  public static final String SOURCE_NAME = "<console>";

  static final String TOO_MUCH_RECURSION = "InternalError: too much recursion";

  private final Stream stdin;
  private final Stream stdout;
  private final InterruptibleContextFactory factory;
  private final RhinoEnvironment environment;
  private final Completer completer;

  private volatile Runnable exitHandler = () -> { };

  /**
   * Creates an interpreter.
   *
   * @param stdin stream read by {@code readline()} and {@code input()}
   * @param stdout stream receiving printed output and error reports
   * @param instructionThreshold interpreted instructions between cancellation checks
   * @param completionEnabled whether to offer a {@link Completer}
   */
  public RhinoInterpreter(
      final Stream stdin,
      final Stream stdout,
      final int instructionThreshold,
      final boolean completionEnabled) {
    Validate.notNull(stdin, "stdin must not be null");
    Validate.notNull(stdout, "stdout must not be null");
    this.stdin = stdin;
    this.stdout = stdout;
    this.factory = new InterruptibleContextFactory(instructionThreshold);

    try (Context cx = this.factory.enterContext()) {
      final ScriptableObject scope = cx.initStandardObjects();
      installBuiltins(scope);
      this.environment = new RhinoEnvironment(this.factory, scope);
    }
    this.completer = completionEnabled ? new ScopeCompleter(this.environment) : null;
  }

  @Override
  public boolean isCompilableUnit(final String source) {
    Validate.notNull(source, "source must not be null");
    try (Context cx = this.factory.enterContext()) {
      return cx.stringIsCompilableUnit(source);
    }
  }

  @Override
  public ExecutionResult execute(final Execution execution) {
    Validate.notNull(execution, "execution must not be null");
    try (Context cx = this.factory.enterContext()) {
      cx.putThreadLocal(Execution.class, execution);
      boolean compiled = false;
      try {
        execution.checkpoint();
        final Script script = cx.compileString(execution.source(), SOURCE_NAME, 1, null);
        compiled = true;
        final Object result = script.exec(cx, this.environment.scope());
        return ExecutionResult.completed(display(result));
      } catch (ExecutionInterruptedError e) {
        LOGGER.debug("{} interrupted", execution);
        this.stdout.write(ExecutionInterruptedError.MARKER + "\n");
      } catch (RhinoException e) {
        this.stdout.write(formatError(e, !compiled));
      } catch (StackOverflowError e) {
        // native callbacks recurse on the Java stack, beyond the interpreter depth limit
        LOGGER.debug("{} overflowed the worker stack", execution);
        this.stdout.write(TOO_MUCH_RECURSION + "\n");
      } catch (RuntimeException e) {
        LOGGER.warn("{} failed outside the script engine: {}", execution, e.getMessage(), e);
        this.stdout.write("InternalError: " + e.getClass().getName() + ": " + e.getMessage() + "\n");
      } finally {
        cx.removeThreadLocal(Execution.class);
      }
      return ExecutionResult.failed();
    }
  }

  @Override
  public Environment environment() {
    return this.environment;
  }

  @Override
  public Optional<Completer> completer() {
    return Optional.ofNullable(this.completer);
  }

  @Override
  public void setExitHandler(final Runnable handler) {
    Validate.notNull(handler, "handler must not be null");
    this.exitHandler = handler;
  }

  /**
   * Formats a script error the way it appears in the transcript.
   *
   * @param e script error
   * @param syntax whether {@code e} was raised while compiling
   * @return newline-terminated report
   */
  static String formatError(final RhinoException e, final boolean syntax) {
    final StringBuilder sb = new StringBuilder();
    if (e instanceof EvaluatorException && syntax) {
      sb.append("SyntaxError: ").append(e.details());
      if (e.sourceName() != null) {
        sb.append(" (").append(e.sourceName()).append('#').append(e.lineNumber()).append(')');
      }
    } else if (e instanceof EvaluatorException) {
      sb.append("InternalError: ").append(e.details());
    } else if (e instanceof JavaScriptException) {
      sb.append("Uncaught ").append(e.getMessage());
    } else {
      sb.append(e.getMessage());
    }
    sb.append('\n');
    final String trace = e.getScriptStackTrace();
    if (StringUtils.isNotBlank(trace)) {
      sb.append(trace);
      if (!trace.endsWith("\n")) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private static String display(final Object result) {
    if (result instanceof Undefined) {
      return null;
    }
    return Context.toString(result);
  }

  private void installBuiltins(final ScriptableObject scope) {
    Builtin.define(scope, "print", 0, (cx, args) -> {
      final StringBuilder sb = new StringBuilder();
      for (int i = 0; i < args.length; i++) {
        if (i > 0) {
          sb.append(' ');
        }
        sb.append(Context.toString(args[i]));
      }
      this.stdout.write(sb.append('\n').toString());
      return Undefined.instance;
    });
    Builtin.define(scope, "write", 1, (cx, args) -> {
      if (args.length > 0) {
        this.stdout.write(Context.toString(args[0]));
      }
      return Undefined.instance;
    });
    Builtin.define(scope, "readline", 0, (cx, args) -> readStdin(cx));
    Builtin.define(scope, "input", 1, (cx, args) -> {
      if (args.length > 0 && !(args[0] instanceof Undefined)) {
        this.stdout.write(Context.toString(args[0]));
      }
      return readStdin(cx);
    });
    final Builtin.Body exit = (cx, args) -> {
      this.exitHandler.run();
      return Undefined.instance;
    };
    Builtin.define(scope, "exit", 0, exit);
    Builtin.define(scope, "quit", 0, exit);
  }

  /**
   * Reads a stdin line on behalf of the running execution.
   *
   * <p>The wake epoch is pinned before the cancellation check, so a cancel that lands between the
   * check and the wait still ends the wait.
   */
  private Object readStdin(final Context cx) {
    final Object current = cx.getThreadLocal(Execution.class);
    final Execution execution = current instanceof Execution ? (Execution) current : null;
    final long epoch = this.stdin.wakeEpoch();
    if (execution != null) {
      execution.checkpoint();
    }
    final String line;
    try {
      line = this.stdin.readlineSince(epoch, true, null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExecutionInterruptedError(execution == null ? -1L : execution.id());
    } catch (TimeoutException e) {
      throw new IllegalStateException("untimed read timed out", e);
    }
    if (execution != null) {
      execution.checkpoint();
    }
    return line;
  }
}
