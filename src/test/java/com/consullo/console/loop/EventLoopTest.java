package com.consullo.console.loop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventLoop}.
 *
 * @since 1.0
 */
public class EventLoopTest {

  @Test
  @DisplayName("Should run pending tasks in submission order")
  void processPendingEvents_QueuedTasks_RunInOrder() {
    final EventLoop loop = new EventLoop();
    final List<Integer> order = new ArrayList<>();
    loop.execute(() -> order.add(1));
    loop.execute(() -> order.add(2));
    loop.execute(() -> order.add(3));

    assertThat(loop.processPendingEvents()).isEqualTo(3);
    assertThat(order).containsExactly(1, 2, 3);
    assertThat(loop.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should leave tasks posted by a running task for the next round")
  void processPendingEvents_TaskPostsTask_DefersNewTask() {
    final EventLoop loop = new EventLoop();
    final List<String> order = new ArrayList<>();
    loop.execute(() -> {
      order.add("outer");
      loop.execute(() -> order.add("inner"));
    });

    assertThat(loop.processPendingEvents()).isEqualTo(1);
    assertThat(order).containsExactly("outer");
    assertThat(loop.processPendingEvents()).isEqualTo(1);
    assertThat(order).containsExactly("outer", "inner");
  }

  @Test
  @DisplayName("Should keep running after a task throws")
  void processPendingEvents_FailingTask_ContinuesWithNext() {
    final EventLoop loop = new EventLoop();
    final AtomicBoolean ran = new AtomicBoolean();
    loop.execute(() -> {
      throw new IllegalStateException("boom");
    });
    loop.execute(() -> ran.set(true));

    assertThat(loop.processPendingEvents()).isEqualTo(2);
    assertThat(ran).isTrue();
  }

  @Test
  @DisplayName("Should return zero when nothing arrives within the wait")
  void processEvents_EmptyQueue_TimesOut() throws Exception {
    final EventLoop loop = new EventLoop();

    assertThat(loop.processEvents(Duration.ofMillis(20))).isZero();
  }

  @Test
  @DisplayName("Should run a task posted from another thread")
  void processEventsUntil_CrossThreadTask_ConditionMet() throws Exception {
    final EventLoop loop = new EventLoop();
    final AtomicBoolean done = new AtomicBoolean();
    final Thread poster = new Thread(() -> loop.execute(() -> done.set(true)));
    poster.start();

    assertThat(loop.processEventsUntil(done::get, Duration.ofSeconds(5))).isTrue();
    poster.join();
  }

  @Test
  @DisplayName("Should report a timeout when the condition never holds")
  void processEventsUntil_NeverTrue_ReturnsFalse() throws Exception {
    final EventLoop loop = new EventLoop();

    assertThat(loop.processEventsUntil(() -> false, Duration.ofMillis(100))).isFalse();
  }

  @Test
  @DisplayName("Should dispatch until quit is called")
  void run_QuitFromTask_Returns() throws Exception {
    final EventLoop loop = new EventLoop();
    final CountDownLatch stopped = new CountDownLatch(1);
    final Thread runner = new Thread(() -> {
      try {
        loop.run();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      stopped.countDown();
    });
    runner.start();

    loop.execute(loop::quit);

    assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
  }
}
