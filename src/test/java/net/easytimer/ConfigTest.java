package net.easytimer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.junit.Test;

public class ConfigTest {
  private final ClassLoader classLoader = ConfigTest.class.getClassLoader();

  @Test
  public void load_defaultsOverlaidByProperties() throws IOException {
    var config = Config.load(classLoader, Map.of());

    assertEquals("EasyTimer-RunLoop", config.runLoopThreadName());
    assertEquals(Duration.ofHours(1), config.runLoopMaxWait());
    assertEquals(Duration.ofMillis(250), config.heartbeatInterval());
  }

  @Test
  public void load_environmentTakesPrecedence() throws IOException {
    var config = Config.load(classLoader, Map.of(
        "RUN_LOOP_MAX_WAIT", "5s",
        "HEARTBEAT_INTERVAL", ""));

    assertEquals(Duration.ofSeconds(5), config.runLoopMaxWait());
    // Empty values are ignored
    assertEquals(Duration.ofMillis(250), config.heartbeatInterval());
  }

  @Test
  public void load_missingOption() {
    var empty = new ClassLoader(null) {
    };

    assertThatThrownBy(() -> Config.load(empty, Map.of()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("missing required option");
  }

  @Test
  public void envVarName() {
    assertEquals("RUN_LOOP_THREAD_NAME", Config.envVarName("runLoop.threadName"));
    assertEquals("HEARTBEAT_INTERVAL", Config.envVarName("heartbeat.interval"));
  }
}
