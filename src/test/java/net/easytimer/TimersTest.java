package net.easytimer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class TimersTest {
  @Test
  public void delay_onCurrentLoop() throws InterruptedException {
    var runLoop = StandardRunLoop.current();
    var calls = new AtomicInteger();

    var timer = Timers.delay(Duration.ofMillis(100), () -> calls.incrementAndGet());
    assertTrue(runLoop.containsTimer(timer, RunLoopMode.DEFAULT));
    assertEquals(0, calls.get());

    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (calls.get() == 0 && System.nanoTime() < deadline) {
      runLoop.runOnce(RunLoopMode.DEFAULT, Duration.ofMillis(500));
    }

    assertEquals(1, calls.get());
    assertFalse(timer.isValid());
    assertFalse(runLoop.containsTimer(timer, RunLoopMode.DEFAULT));
  }

  @Test
  public void interval_stoppedOnCurrentLoop() {
    var calls = new AtomicInteger();

    var timer = Timers.interval(Duration.ofHours(1), t -> {
      calls.incrementAndGet();
    });
    assertEquals(1, calls.get());
    assertTrue(StandardRunLoop.current().containsTimer(timer, RunLoopMode.DEFAULT));

    timer.stop();
    assertFalse(StandardRunLoop.current().containsTimer(timer, RunLoopMode.DEFAULT));
  }

  @Test
  public void delayedInterval_onCurrentLoop() {
    var timer = Timers.delayedInterval(Duration.ofHours(1), () -> {});

    try {
      assertTrue(timer.repeats());
      assertTrue(StandardRunLoop.current().containsTimer(timer, RunLoopMode.DEFAULT));
    } finally {
      timer.stop();
    }
  }
}
