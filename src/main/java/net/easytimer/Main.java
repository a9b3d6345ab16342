package net.easytimer;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws IOException {
    Thread.setDefaultUncaughtExceptionHandler((thread, ex) -> {
      log.error("Caught unhandled exception. Terminating; thread={}", thread, ex);
      System.exit(1);
    });

    var config = Config.load();
    log.info("Config {}", config);

    var clock = Clock.systemUTC();
    var service = RunLoopService.fromConfig(config, new StandardRunLoop(clock));
    service.startAsync().awaitRunning();

    var beats = new AtomicLong();
    var heartbeat = new TimerFactory(clock).interval(
        config.heartbeatInterval(),
        service.runLoop(),
        () -> log.info("Heartbeat; count={}", beats.incrementAndGet()));

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      heartbeat.stop(service.runLoop());
      service.stopAsync().awaitTerminated();
      log.info("Stopped after {} heartbeats", beats.get());
    }));

    service.awaitTerminated();
  }
}
