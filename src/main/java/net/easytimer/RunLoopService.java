package net.easytimer;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.AbstractExecutionThreadService;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link StandardRunLoop} on a dedicated thread. While the service runs, the loop is
 * the {@link StandardRunLoop#current() current} loop of that thread, so timers started from
 * within callbacks without an explicit loop land on it.
 */
public class RunLoopService extends AbstractExecutionThreadService {
  private static final Logger log = LoggerFactory.getLogger(RunLoopService.class);

  private final StandardRunLoop runLoop;
  private final RunLoopMode mode;
  private final Duration maxWait;
  private final String threadName;

  public RunLoopService(
      StandardRunLoop runLoop,
      RunLoopMode mode,
      Duration maxWait,
      String threadName) {
    Preconditions.checkArgument(
        !maxWait.isNegative() && !maxWait.isZero(),
        "maxWait must be positive: %s", maxWait);
    this.runLoop = Preconditions.checkNotNull(runLoop, "runLoop");
    this.mode = Preconditions.checkNotNull(mode, "mode");
    this.maxWait = maxWait;
    this.threadName = Preconditions.checkNotNull(threadName, "threadName");
  }

  public static RunLoopService fromConfig(Config config, StandardRunLoop runLoop) {
    return new RunLoopService(
        runLoop,
        RunLoopMode.DEFAULT,
        config.runLoopMaxWait(),
        config.runLoopThreadName());
  }

  public StandardRunLoop runLoop() {
    return runLoop;
  }

  @Override
  protected String serviceName() {
    return threadName;
  }

  @Override
  protected void startUp() {
    StandardRunLoop.bindCurrent(runLoop);
    log.info("Run loop started; mode={}, maxWait={}", mode, maxWait);
  }

  @Override
  protected void run() throws Exception {
    while (isRunning()) {
      runLoop.runOnce(mode, maxWait);
    }
  }

  @Override
  protected void triggerShutdown() {
    runLoop.wakeUp();
  }

  @Override
  protected void shutDown() {
    StandardRunLoop.unbindCurrent();
    log.info("Run loop stopped; mode={}", mode);
  }
}
