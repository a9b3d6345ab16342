package net.easytimer;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Builds {@link Timer}s for a duration and a firing policy.
 *
 * <p>The firing policy is the pair {@code (repeats, delays)}:
 * <ul>
 *   <li>{@code repeats} selects a timer that fires every {@code duration} instead of once.
 *   <li>{@code delays} selects whether the first fire waits a full {@code duration}. Without it,
 *   the callback is invoked synchronously once before the timer is returned, and the scheduled
 *   fires follow at {@code duration}, {@code 2 * duration}, and so on.
 * </ul>
 *
 * <p>The named policies {@link #delay}, {@link #interval} and {@link #delayedInterval} build the
 * timer and start it on the given loop in one step.
 */
public class TimerFactory {
  private final Clock clock;

  public TimerFactory(Clock clock) {
    this.clock = Preconditions.checkNotNull(clock, "clock");
  }

  public static TimerFactory systemDefault() {
    return new TimerFactory(Clock.systemUTC());
  }

  public Clock clock() {
    return clock;
  }

  /**
   * Creates a timer that will call {@code block} once or repeatedly every {@code duration}.
   *
   * <p>The timer does not fire until it is started on a run loop. Note that
   * {@code repeats == false && delays == false} calls {@code block} immediately <em>and</em>
   * returns a timer that fires once more after {@code duration}.
   *
   * <p>The fire date is taken before {@code block} runs immediately. An immediate call that takes
   * longer than {@code duration} is therefore followed by the first scheduled fire right away.
   *
   * @throws IllegalArgumentException if {@code duration} is negative or too large for a fire
   *     date
   */
  public Timer buildTimer(Duration duration, boolean repeats, boolean delays, Runnable block) {
    return buildTimer(duration, repeats, delays, TimerCallback.of(block));
  }

  /**
   * Creates a timer that will call {@code callback} once or repeatedly every {@code duration},
   * passing the timer itself to every invocation.
   *
   * @throws IllegalArgumentException if {@code duration} is negative or too large for a fire
   *     date
   */
  public Timer buildTimer(
      Duration duration,
      boolean repeats,
      boolean delays,
      TimerCallback callback) {
    checkDuration(duration);
    Preconditions.checkNotNull(callback, "callback");

    var timer = new Timer(fireDateAfter(duration), duration, repeats, callback);
    if (!delays) {
      timer.invoke();
    }
    return timer;
  }

  /**
   * Creates and starts a timer that calls {@code block} once, {@code duration} from now.
   */
  public Timer delay(Duration duration, RunLoop runLoop, Runnable block) {
    return schedule(duration, false, true, runLoop, TimerCallback.of(block));
  }

  public Timer delay(Duration duration, RunLoop runLoop, TimerCallback callback) {
    return schedule(duration, false, true, runLoop, callback);
  }

  /**
   * Creates and starts a timer that calls {@code block} right away and then every
   * {@code duration}.
   */
  public Timer interval(Duration duration, RunLoop runLoop, Runnable block) {
    return schedule(duration, true, false, runLoop, TimerCallback.of(block));
  }

  public Timer interval(Duration duration, RunLoop runLoop, TimerCallback callback) {
    return schedule(duration, true, false, runLoop, callback);
  }

  /**
   * Creates and starts a timer that calls {@code block} every {@code duration}, the first time
   * {@code duration} from now.
   */
  public Timer delayedInterval(Duration duration, RunLoop runLoop, Runnable block) {
    return schedule(duration, true, true, runLoop, TimerCallback.of(block));
  }

  public Timer delayedInterval(Duration duration, RunLoop runLoop, TimerCallback callback) {
    return schedule(duration, true, true, runLoop, callback);
  }

  private Timer schedule(
      Duration duration,
      boolean repeats,
      boolean delays,
      RunLoop runLoop,
      TimerCallback callback) {
    Preconditions.checkNotNull(runLoop, "runLoop");
    var timer = buildTimer(duration, repeats, delays, callback);
    timer.start(runLoop);
    return timer;
  }

  private Instant fireDateAfter(Duration duration) {
    try {
      return clock.instant().plus(duration);
    } catch (ArithmeticException | DateTimeException e) {
      throw new IllegalArgumentException("duration out of range: " + duration, e);
    }
  }

  private static void checkDuration(Duration duration) {
    Preconditions.checkArgument(duration != null, "duration must not be null");
    Preconditions.checkArgument(!duration.isNegative(), "negative duration: %s", duration);
  }
}
