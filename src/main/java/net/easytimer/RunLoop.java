package net.easytimer;

/**
 * An event loop able to deliver timer fires. The loop holds the timers it was given only in
 * order to invoke them; it never owns their lifetime.
 */
public interface RunLoop {
  /**
   * Registers the timer for the given mode. Once registered, the timer fires on the loop at or
   * after its fire date while the loop runs in that mode. Registering a timer that is already
   * registered, or that has been invalidated, has no effect.
   */
  void addTimer(Timer timer, RunLoopMode mode);

  /**
   * Removes the timer from the given mode. Removing a timer that is not registered has no
   * effect.
   */
  void removeTimer(Timer timer, RunLoopMode mode);

  boolean containsTimer(Timer timer, RunLoopMode mode);
}
