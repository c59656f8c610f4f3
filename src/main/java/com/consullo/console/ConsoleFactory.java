package com.consullo.console;

import com.consullo.console.exec.rhino.RhinoInterpreter;
import com.consullo.console.loop.EventLoop;
import com.consullo.console.stream.Stream;

/**
 * Factory for JavaScript consoles with default wiring.
 *
 * <p>
 * This class centralizes the pieces every embedder would otherwise assemble by hand:
 * <ul>
 * <li>a fresh foreground {@link EventLoop}</li>
 * <li>the stdin/stdout stream pair shared by console and interpreter</li>
 * <li>a Rhino interpreter configured from {@link ConsoleConfig}</li>
 * </ul>
 * </p>
 */
public final class ConsoleFactory {

  private ConsoleFactory() {
  }

  /**
   * Create a console with {@link ConsoleConfig#defaults()}.
   *
   * @return console, idle at its first prompt
   */
  public static Console createConsole() {
    return createConsole(ConsoleConfig.defaults());
  }

  /**
   * Create a console.
   *
   * @param config configuration values
   * @return console, idle at its first prompt
   */
  public static Console createConsole(final ConsoleConfig config) {
    return createConsole(config, new EventLoop());
  }

  /**
   * Create a console that delivers its events on an existing loop.
   *
   * @param config configuration values
   * @param loop foreground loop
   * @return console, idle at its first prompt
   */
  public static Console createConsole(final ConsoleConfig config, final EventLoop loop) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    if (loop == null) {
      throw new IllegalArgumentException("loop must not be null.");
    }

    Stream stdin = new Stream("stdin");
    Stream stdout = new Stream("stdout");
    RhinoInterpreter interpreter = new RhinoInterpreter(
            stdin,
            stdout,
            config.instructionThreshold(),
            config.completionEnabled()
    );
    return new Console(config, interpreter, stdin, stdout, loop);
  }
}
