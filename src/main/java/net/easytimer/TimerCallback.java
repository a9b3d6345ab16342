package net.easytimer;

import com.google.common.base.Preconditions;

/**
 * Code run on every fire of a {@link Timer}. The firing timer is passed in so the callback can
 * inspect or invalidate it, including on an immediate (pre-schedule) invocation.
 */
@FunctionalInterface
public interface TimerCallback {
  void run(Timer timer);

  /**
   * Adapts a callback that has no use for the firing timer.
   */
  static TimerCallback of(Runnable block) {
    Preconditions.checkNotNull(block, "block");
    return timer -> block.run();
  }
}
