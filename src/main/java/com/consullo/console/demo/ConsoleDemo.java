package com.consullo.console.demo;

import com.consullo.console.Console;
import com.consullo.console.ConsoleConfig;
import com.consullo.console.ConsoleFactory;
import com.consullo.console.log.Domain;
import com.consullo.console.log.LogRecord;
import com.consullo.console.loop.EventLoop;
import com.consullo.console.transcript.Transcript;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented driver for a threaded JavaScript console.
 *
 * <p>
 * Every line read is typed into the input buffer and submitted. After each line the demo gives the
 * console a moment to go idle, then prints the records added since the last round. Input records
 * are not printed back; the terminal already shows what was typed. A line reading {@code :cancel}
 * interrupts the running code, and end of input exits.
 *
 * @since 1.0
 */
public final class ConsoleDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleDemo.class);

  public static final String CANCEL_COMMAND = ":cancel";

  private ConsoleDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    run(in, System.out, Duration.ofSeconds(1));
  }

  /**
   * Drives a console until end of input or until the script exits.
   *
   * @param in lines to type
   * @param out where the transcript is printed
   * @param idleTimeout how long to wait for an execution before reading the next line
   * @throws IOException if reading {@code in} fails
   * @throws InterruptedException if interrupted while waiting for the console
   */
  public static void run(final BufferedReader in, final PrintStream out, final Duration idleTimeout)
      throws IOException, InterruptedException {
    try (final Console console = ConsoleFactory.createConsole(ConsoleConfig.defaults())) {
      final EventLoop loop = console.eventLoop();
      LOGGER.info("Console demo started");

      int shown = 0;
      printPrompt(console, out);
      String line;
      while (!console.isExited() && (line = in.readLine()) != null) {
        if (CANCEL_COMMAND.equals(line.trim())) {
          console.cancel();
        } else {
          console.insertInputText(line);
          console.processInput();
        }
        loop.processEventsUntil(() -> !console.isRunning() || console.isExited(), idleTimeout);
        shown = printRecords(console.transcript(), shown, out);
        if (!console.isExited()) {
          printPrompt(console, out);
        }
      }
      LOGGER.info("Console demo finished after {} executions", console.counter());
    }
  }

  private static int printRecords(final Transcript transcript, final int from, final PrintStream out) {
    final int end = transcript.isInputOpen() ? transcript.size() - 1 : transcript.size();
    for (int i = from; i < end; i++) {
      final LogRecord record = transcript.record(i);
      if (record.domain() != Domain.INPUT) {
        out.print(render(record));
      }
    }
    out.flush();
    return Math.max(from, end);
  }

  /**
   * Renders a record with its prompt column, one row per line.
   */
  static String render(final LogRecord record) {
    final String text = StringUtils.removeEnd(record.text(), "\n");
    final String[] lines = text.split("\n", -1);
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.length; i++) {
      final String prompt = i < record.numLines() ? record.promptLine(i) : "";
      sb.append(prompt).append(lines[i]).append('\n');
    }
    return sb.toString();
  }

  private static void printPrompt(final Console console, final PrintStream out) {
    final Transcript transcript = console.transcript();
    if (transcript.isInputOpen()) {
      final LogRecord input = transcript.record(transcript.size() - 1);
      out.print(input.promptLine(StringUtils.countMatches(transcript.inputBuffer(), '\n')));
      out.flush();
    }
  }
}
