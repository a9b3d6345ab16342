package net.easytimer;

import com.google.common.base.Preconditions;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single-threaded run loop delivering timer fires.
 *
 * <p>Timers may be added and removed from any thread. Fires are delivered only on the thread
 * driving the loop through {@link #runDueTimers(RunLoopMode)} or
 * {@link #runOnce(RunLoopMode, Duration)}, one at a time and outside of the loop's lock, so a
 * callback is free to add, remove or stop timers (including its own).
 */
public class StandardRunLoop implements RunLoop {
  private static final Logger log = LoggerFactory.getLogger(StandardRunLoop.class);

  private static final ThreadLocal<StandardRunLoop> CURRENT =
      ThreadLocal.withInitial(() -> new StandardRunLoop(Clock.systemUTC()));

  private static final Comparator<Timer> BY_FIRE_DATE = Comparator.comparing(Timer::fireDate);

  private final Clock clock;

  private final Lock lock = new ReentrantLock();
  private final Condition wakeUpSignal = lock.newCondition();
  // Guarded by lock
  private final SetMultimap<RunLoopMode, Timer> timers = LinkedHashMultimap.create();
  private boolean wakeUpPending = false;

  public StandardRunLoop(Clock clock) {
    this.clock = Preconditions.checkNotNull(clock, "clock");
  }

  /**
   * Returns the run loop of the calling thread. A thread gets its own loop, on the system clock,
   * the first time it asks for one unless a loop was bound to it by a {@link RunLoopService}.
   */
  public static StandardRunLoop current() {
    return CURRENT.get();
  }

  static void bindCurrent(StandardRunLoop runLoop) {
    CURRENT.set(runLoop);
  }

  static void unbindCurrent() {
    CURRENT.remove();
  }

  public Clock clock() {
    return clock;
  }

  @Override
  public void addTimer(Timer timer, RunLoopMode mode) {
    Preconditions.checkNotNull(timer, "timer");
    Preconditions.checkNotNull(mode, "mode");
    if (!timer.isValid()) {
      log.debug("Ignoring invalidated timer; timer={}", timer);
      return;
    }

    lock.lock();
    try {
      if (timers.put(mode, timer)) {
        log.debug("Added timer; mode={}, timer={}", mode, timer);
        // Registration may move the next deadline forward
        signalWakeUp();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void removeTimer(Timer timer, RunLoopMode mode) {
    lock.lock();
    try {
      if (timers.remove(mode, timer)) {
        log.debug("Removed timer; mode={}, timer={}", mode, timer);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean containsTimer(Timer timer, RunLoopMode mode) {
    lock.lock();
    try {
      return timers.containsEntry(mode, timer);
    } finally {
      lock.unlock();
    }
  }

  public int timerCount(RunLoopMode mode) {
    lock.lock();
    try {
      return timers.get(mode).size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the earliest fire date of the valid timers registered for the given mode.
   */
  public Optional<Instant> nextFireDate(RunLoopMode mode) {
    lock.lock();
    try {
      return nextFireDateLocked(mode);
    } finally {
      lock.unlock();
    }
  }

  // lock must be held
  private Optional<Instant> nextFireDateLocked(RunLoopMode mode) {
    return timers.get(mode).stream()
        .filter(Timer::isValid)
        .map(Timer::fireDate)
        .min(Comparator.naturalOrder());
  }

  /**
   * Fires every timer registered for the given mode whose fire date has been reached, in fire
   * date order. Returns the number of timers fired.
   */
  public int runDueTimers(RunLoopMode mode) {
    var now = clock.instant();
    List<Timer> due = new ArrayList<>();

    lock.lock();
    try {
      purgeInvalidTimers();
      for (Timer timer : timers.get(mode)) {
        if (!timer.fireDate().isAfter(now)) {
          due.add(timer);
        }
      }
    } finally {
      lock.unlock();
    }

    due.sort(BY_FIRE_DATE);

    int fired = 0;
    for (Timer timer : due) {
      // An earlier callback in this pass may have stopped the timer
      if (!timer.isValid() || !containsTimer(timer, mode)) {
        continue;
      }

      fire(timer);
      fired++;

      if (!timer.isValid()) {
        removeFromAllModes(timer);
      }
    }

    return fired;
  }

  private void fire(Timer timer) {
    try {
      timer.fire(clock);
    } catch (RuntimeException e) {
      log.error("Timer callback failed. Invalidating timer; timer={}", timer, e);
      timer.invalidate();
    }
  }

  /**
   * Runs due timers. If none were due, waits for the next fire date, a {@link #wakeUp()} or
   * {@code maxWait}, whichever comes first, and then runs due timers again. Returns the number of
   * timers fired.
   */
  public int runOnce(RunLoopMode mode, Duration maxWait) throws InterruptedException {
    Preconditions.checkArgument(!maxWait.isNegative(), "negative maxWait: %s", maxWait);

    int fired = runDueTimers(mode);
    if (fired > 0) {
      return fired;
    }

    lock.lock();
    try {
      if (!wakeUpPending) {
        var wait = maxWait;
        var next = nextFireDateLocked(mode);
        if (next.isPresent()) {
          var untilNext = Duration.between(clock.instant(), next.get());
          if (untilNext.compareTo(wait) < 0) {
            wait = untilNext;
          }
        }

        if (!wait.isNegative() && !wait.isZero()) {
          wakeUpSignal.awaitNanos(wait.toNanos());
        }
      }
      wakeUpPending = false;
    } finally {
      lock.unlock();
    }

    return runDueTimers(mode);
  }

  /**
   * Makes a pending or the next {@link #runOnce(RunLoopMode, Duration)} wait return early.
   */
  public void wakeUp() {
    lock.lock();
    try {
      signalWakeUp();
    } finally {
      lock.unlock();
    }
  }

  // lock must be held
  private void signalWakeUp() {
    wakeUpPending = true;
    wakeUpSignal.signalAll();
  }

  // lock must be held
  private void purgeInvalidTimers() {
    var removed = timers.entries().removeIf(entry -> !entry.getValue().isValid());
    if (removed) {
      log.debug("Purged invalidated timers");
    }
  }

  private void removeFromAllModes(Timer timer) {
    lock.lock();
    try {
      timers.values().removeIf(t -> t == timer);
    } finally {
      lock.unlock();
    }
  }
}
