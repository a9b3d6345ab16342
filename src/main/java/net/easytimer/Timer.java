package net.easytimer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * A timer that fires its callback once or repeatedly while attached to a {@link RunLoop}.
 *
 * <p>Timers are created by a {@link TimerFactory} in an unattached state. {@link #start(RunLoop)}
 * attaches the timer to a loop; {@link #stop(RunLoop)} invalidates and detaches it. Once
 * invalidated a timer never fires again, even if it is attached to a loop afterwards.
 */
public final class Timer {
  private final Duration timeInterval;
  private final boolean repeats;
  private final TimerCallback callback;

  // Guarded by this
  private Instant fireDate;
  private volatile boolean valid = true;

  Timer(Instant fireDate, Duration timeInterval, boolean repeats, TimerCallback callback) {
    this.fireDate = Preconditions.checkNotNull(fireDate, "fireDate");
    this.timeInterval = Preconditions.checkNotNull(timeInterval, "timeInterval");
    // A zero interval can not repeat. The timer fires once, same as a non-repeating one.
    this.repeats = repeats && !timeInterval.isZero();
    this.callback = Preconditions.checkNotNull(callback, "callback");
  }

  /**
   * Schedules this timer on the given loop for the default mode.
   */
  public void start(RunLoop runLoop) {
    runLoop.addTimer(this, RunLoopMode.DEFAULT);
  }

  /**
   * Schedules this timer on the current thread's run loop for the default mode.
   */
  public void start() {
    start(StandardRunLoop.current());
  }

  /**
   * Invalidates this timer and removes it from the given loop's default mode. May be called
   * from within the timer's own callback. Stopping a stopped timer has no effect.
   */
  public void stop(RunLoop runLoop) {
    invalidate();
    runLoop.removeTimer(this, RunLoopMode.DEFAULT);
  }

  /**
   * Invalidates this timer and removes it from the current thread's run loop.
   */
  public void stop() {
    stop(StandardRunLoop.current());
  }

  /**
   * Stops the timer from ever firing again. Loops drop invalidated timers lazily.
   */
  public void invalidate() {
    valid = false;
  }

  public boolean isValid() {
    return valid;
  }

  /**
   * The next time this timer is due to fire.
   */
  public synchronized Instant fireDate() {
    return fireDate;
  }

  public Duration timeInterval() {
    return timeInterval;
  }

  public boolean repeats() {
    return repeats;
  }

  /**
   * Invokes the callback outside of any schedule. Used for the immediate call of timers that do
   * not delay their first fire.
   */
  void invoke() {
    callback.run(this);
  }

  /**
   * Delivers a scheduled fire. Called by a run loop once the fire date has been reached.
   * Afterwards a repeating timer advances to the first period boundary after the clock's
   * current time, and a non-repeating timer is invalidated.
   */
  void fire(Clock clock) {
    if (!valid) {
      return;
    }

    try {
      callback.run(this);
    } finally {
      if (repeats) {
        advanceFireDate(clock.instant());
      } else {
        invalidate();
      }
    }
  }

  @VisibleForTesting
  synchronized void advanceFireDate(Instant now) {
    // Period pacing: the schedule is anchored on the previous fire date, not on the time the
    // callback returned. Periods missed entirely are skipped.
    var behind = Duration.between(fireDate, now);
    long periods = behind.isNegative() ? 1 : behind.dividedBy(timeInterval) + 1;
    try {
      fireDate = fireDate.plus(timeInterval.multipliedBy(periods));
    } catch (ArithmeticException | DateTimeException e) {
      // Next fire lies beyond the representable time line
      fireDate = Instant.MAX;
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("fireDate", fireDate())
        .add("timeInterval", timeInterval)
        .add("repeats", repeats)
        .add("valid", valid)
        .toString();
  }
}
