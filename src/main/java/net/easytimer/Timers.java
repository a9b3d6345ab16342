package net.easytimer;

import java.time.Duration;

/**
 * Shorthands scheduling timers on the current thread's run loop with the system clock.
 *
 * @see TimerFactory
 * @see StandardRunLoop#current()
 */
public final class Timers {
  private static final TimerFactory FACTORY = TimerFactory.systemDefault();

  private Timers() {
  }

  public static Timer delay(Duration duration, Runnable block) {
    return FACTORY.delay(duration, StandardRunLoop.current(), block);
  }

  public static Timer delay(Duration duration, TimerCallback callback) {
    return FACTORY.delay(duration, StandardRunLoop.current(), callback);
  }

  public static Timer interval(Duration duration, Runnable block) {
    return FACTORY.interval(duration, StandardRunLoop.current(), block);
  }

  public static Timer interval(Duration duration, TimerCallback callback) {
    return FACTORY.interval(duration, StandardRunLoop.current(), callback);
  }

  public static Timer delayedInterval(Duration duration, Runnable block) {
    return FACTORY.delayedInterval(duration, StandardRunLoop.current(), block);
  }

  public static Timer delayedInterval(Duration duration, TimerCallback callback) {
    return FACTORY.delayedInterval(duration, StandardRunLoop.current(), callback);
  }
}
