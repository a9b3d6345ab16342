package net.easytimer.util;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;

import java.time.Duration;
import org.junit.Test;

public class DurationsTest {
  @Test
  public void fromString_noUnit() {
    assertEquals(Duration.ofMillis(1234), Durations.fromString("1234"));
  }

  @Test
  public void fromString_ms() {
    assertEquals(Duration.ofMillis(250), Durations.fromString("250ms"));
  }

  @Test
  public void fromString_withWhitespace() {
    assertEquals(Duration.ofSeconds(2), Durations.fromString(" 2 s "));
  }

  @Test
  public void fromString_hours() {
    assertEquals(Duration.ofHours(1), Durations.fromString("1h"));
  }

  @Test
  public void fromString_unknownUnit() {
    assertThatThrownBy(() -> Durations.fromString("5 fortnights"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unknown unit");
  }

  @Test
  public void fromString_negative() {
    assertThatThrownBy(() -> Durations.fromString("-5s"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void ofSeconds_fraction() {
    assertEquals(Duration.ofMillis(100), Durations.ofSeconds(0.1));
    assertEquals(Duration.ofMillis(1500), Durations.ofSeconds(1.5));
    assertEquals(Duration.ZERO, Durations.ofSeconds(0));
  }

  @Test
  public void ofSeconds_rejectsNegative() {
    assertThatThrownBy(() -> Durations.ofSeconds(-0.5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  public void ofSeconds_rejectsTooLarge() {
    assertThatThrownBy(() -> Durations.ofSeconds(1e19))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  public void ofSeconds_largestRepresentable() {
    assertEquals(Duration.ofSeconds(1L << 62), Durations.ofSeconds(0x1p62));
  }

  @Test
  public void ofSeconds_rejectsNonFinite() {
    assertThatThrownBy(() -> Durations.ofSeconds(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Durations.ofSeconds(Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
