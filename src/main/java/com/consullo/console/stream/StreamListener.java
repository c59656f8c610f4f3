package com.consullo.console.stream;

/**
 * Observer of {@link Stream} activity.
 *
 * <p>Callbacks run on the thread that performed the operation, after the stream lock has been
 * released. Listeners that touch foreground state must marshal onto the foreground themselves.
 *
 * @since 1.0
 */
public interface StreamListener {

  /**
   * Called after {@code data} was appended to the backlog.
   *
   * @param data written text
   */
  default void onWrite(String data) {
  }

  /**
   * Called after the backlog was drained by a flush.
   *
   * @param data drained text, possibly empty
   */
  default void onFlush(String data) {
  }

  /**
   * Called once, when the stream is closed.
   */
  default void onClose() {
  }
}
