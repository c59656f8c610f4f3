package com.consullo.console.stream;

import com.consullo.console.loop.EventLoop;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe, line-oriented text channel standing in for a worker's stdin or stdout.
 *
 * <p>The backlog is a FIFO guarded by a single lock; it is the only state shared between the
 * foreground and a worker thread. Readers suspend in one of two ways:
 * <ul>
 * <li>blocking wait on a lock condition (default), for readers on a thread other than the
 * writer;</li>
 * <li>cooperative re-entry into an {@link EventLoop} (see {@link #cooperateWith(EventLoop)}), for
 * readers that share a single thread with the writer.</li>
 * </ul>
 *
 * <p>{@link #close()} and {@link #wake()} both release waiting readers, so a blocked read can
 * always be ended from another thread.
 *
 * @since 1.0
 */
public final class Stream {

  private static final Logger LOGGER = LoggerFactory.getLogger(Stream.class);

  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = this.lock.newCondition();
  private final StringBuilder backlog = new StringBuilder();
  private final List<StreamListener> listeners = new CopyOnWriteArrayList<>();

  // guarded by lock
  private boolean closed;
  private long wakeEpoch;
  private int cooperativeWaiters;

  private volatile EventLoop cooperativeLoop;

  public Stream(final String name) {
    Validate.notBlank(name, "name must not be blank");
    this.name = name;
  }

  public String name() {
    return this.name;
  }

  public void addListener(final StreamListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final StreamListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Selects the suspension mechanism for blocking reads.
   *
   * @param loop loop to re-enter while waiting, or {@code null} for a blocking condition wait
   */
  public void cooperateWith(final EventLoop loop) {
    this.cooperativeLoop = loop;
  }

  public boolean isCooperative() {
    return this.cooperativeLoop != null;
  }

  /**
   * Appends {@code data} to the backlog and wakes blocked readers. Never blocks on readers.
   *
   * @param data text to append
   */
  public void write(final String data) {
    Validate.notNull(data, "data must not be null");
    if (data.isEmpty()) {
      return;
    }
    this.lock.lock();
    try {
      if (this.closed) {
        LOGGER.debug("{}: dropping {} chars written after close", this.name, data.length());
        return;
      }
      this.backlog.append(data);
      signalReaders();
    } finally {
      this.lock.unlock();
    }
    for (StreamListener listener : this.listeners) {
      listener.onWrite(data);
    }
  }

  /**
   * Blocking read with no timeout.
   *
   * @return next line without its line break, or {@code null} at end of stream
   * @throws InterruptedException if interrupted while waiting
   */
  public String readline() throws InterruptedException {
    try {
      return readline(true, null);
    } catch (TimeoutException e) {
      throw new IllegalStateException("untimed read timed out", e);
    }
  }

  /**
   * Pops the next line from the backlog.
   *
   * @param block whether to wait for a line
   * @param timeout maximum wait, {@code null} for none
   * @return the line without its break; {@code ""} for a non-blocking miss or a {@link #wake()};
   *     {@code null} at end of stream
   * @throws InterruptedException if interrupted while waiting
   * @throws TimeoutException if {@code timeout} elapsed before a line arrived
   */
  public String readline(final boolean block, final Duration timeout)
      throws InterruptedException, TimeoutException {
    return readlineSince(wakeEpoch(), block, timeout);
  }

  /**
   * Like {@link #readline(boolean, Duration)}, but any {@link #wake()} after {@code epoch} was
   * observed ends the read, even one delivered before this call.
   *
   * @param epoch value previously returned by {@link #wakeEpoch()}
   * @param block whether to wait for a line
   * @param timeout maximum wait, {@code null} for none
   * @return as for {@link #readline(boolean, Duration)}
   * @throws InterruptedException if interrupted while waiting
   * @throws TimeoutException if {@code timeout} elapsed before a line arrived
   */
  public String readlineSince(final long epoch, final boolean block, final Duration timeout)
      throws InterruptedException, TimeoutException {
    Validate.isTrue(timeout == null || !timeout.isNegative(), "timeout must not be negative");
    final long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();

    this.lock.lock();
    try {
      while (true) {
        final int lineBreak = this.backlog.indexOf("\n");
        if (lineBreak >= 0) {
          final String line = this.backlog.substring(0, lineBreak);
          this.backlog.delete(0, lineBreak + 1);
          return line;
        }
        if (this.closed) {
          if (this.backlog.length() > 0) {
            final String rest = this.backlog.toString();
            this.backlog.setLength(0);
            return rest;
          }
          return null;
        }
        if (this.wakeEpoch != epoch || !block) {
          return "";
        }

        final long remaining = timeout == null ? Long.MAX_VALUE : deadline - System.nanoTime();
        if (remaining <= 0) {
          throw new TimeoutException(this.name + ": no line within " + timeout);
        }

        final EventLoop loop = this.cooperativeLoop;
        if (loop != null) {
          awaitCooperatively(loop, timeout == null ? null : Duration.ofNanos(remaining));
        } else if (timeout == null) {
          this.changed.await();
        } else {
          this.changed.awaitNanos(remaining);
        }
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Drains the whole backlog, including a trailing partial line.
   *
   * @return drained text, empty if nothing was buffered
   */
  public String flush() {
    final String data;
    this.lock.lock();
    try {
      data = this.backlog.toString();
      this.backlog.setLength(0);
    } finally {
      this.lock.unlock();
    }
    for (StreamListener listener : this.listeners) {
      listener.onFlush(data);
    }
    return data;
  }

  /**
   * Returns the current wake epoch. Pass it to {@link #readlineSince(long, boolean, Duration)} to
   * make a read sensitive to wake-ups that happen from this point on.
   *
   * @return wake epoch
   */
  public long wakeEpoch() {
    this.lock.lock();
    try {
      return this.wakeEpoch;
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Releases every reader currently waiting for a line; they return {@code ""}. Buffered content
   * is left untouched.
   */
  public void wake() {
    this.lock.lock();
    try {
      this.wakeEpoch++;
      signalReaders();
    } finally {
      this.lock.unlock();
    }
    LOGGER.debug("{}: woke waiting readers", this.name);
  }

  /**
   * Signals permanent end of stream and releases blocked readers. Idempotent.
   */
  public void close() {
    this.lock.lock();
    try {
      if (this.closed) {
        return;
      }
      this.closed = true;
      signalReaders();
    } finally {
      this.lock.unlock();
    }
    LOGGER.debug("{}: closed", this.name);
    for (StreamListener listener : this.listeners) {
      listener.onClose();
    }
  }

  public boolean isClosed() {
    this.lock.lock();
    try {
      return this.closed;
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Returns the number of buffered characters.
   *
   * @return backlog length
   */
  public int available() {
    this.lock.lock();
    try {
      return this.backlog.length();
    } finally {
      this.lock.unlock();
    }
  }

  private void awaitCooperatively(final EventLoop loop, final Duration maxWait)
      throws InterruptedException {
    this.cooperativeWaiters++;
    this.lock.unlock();
    try {
      loop.processEvents(maxWait);
    } finally {
      this.lock.lock();
      this.cooperativeWaiters--;
    }
  }

  private void signalReaders() {
    this.changed.signalAll();
    final EventLoop loop = this.cooperativeLoop;
    if (loop != null && this.cooperativeWaiters > 0) {
      loop.wakeUp();
    }
  }
}
