package net.easytimer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

public class RunLoopModeTest {
  @Test
  public void of_default() {
    assertSame(RunLoopMode.DEFAULT, RunLoopMode.of("default"));
  }

  @Test
  public void of_equalByName() {
    assertEquals(RunLoopMode.of("tracking"), RunLoopMode.of("tracking"));
    assertNotEquals(RunLoopMode.DEFAULT, RunLoopMode.of("tracking"));
  }

  @Test
  public void of_empty() {
    assertThatThrownBy(() -> RunLoopMode.of(""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
