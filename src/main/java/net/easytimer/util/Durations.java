package net.easytimer.util;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Durations {
  private static final Pattern PARSER = Pattern.compile("(\\d+)\\s*([a-zA-Z]*)$");
  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  // 2^63, the first double past Long.MAX_VALUE
  private static final double MAX_SECONDS = 0x1p63;

  private Durations() {
  }

  /**
   * Parses durations such as {@code "250ms"}, {@code "2 s"} or {@code "1h"}. A bare number is
   * taken as milliseconds.
   */
  public static Duration fromString(String value) {
    Matcher matcher = PARSER.matcher(value.strip());
    Preconditions.checkArgument(matcher.matches(), "unsupported format: %s", value);
    long amount = Long.parseLong(matcher.group(1));
    return Duration.of(amount, parseUnit(matcher.group(2)));
  }

  private static ChronoUnit parseUnit(String unit) {
    switch (unit) {
      case "":
      case "ms":
        return ChronoUnit.MILLIS;
      case "ns":
        return ChronoUnit.NANOS;
      case "us":
        return ChronoUnit.MICROS;
      case "s":
        return ChronoUnit.SECONDS;
      case "m":
        return ChronoUnit.MINUTES;
      case "h":
        return ChronoUnit.HOURS;
      case "d":
        return ChronoUnit.DAYS;
    }
    throw new IllegalArgumentException("unknown unit: " + unit);
  }

  /**
   * Converts a real-valued number of seconds, rounded to the nearest nanosecond.
   *
   * @throws IllegalArgumentException if {@code seconds} is negative, NaN, infinite or does not
   *     fit a {@link Duration}
   */
  public static Duration ofSeconds(double seconds) {
    Preconditions.checkArgument(Double.isFinite(seconds), "non-finite seconds: %s", seconds);
    Preconditions.checkArgument(seconds >= 0, "negative seconds: %s", seconds);
    Preconditions.checkArgument(seconds < MAX_SECONDS, "seconds out of range: %s", seconds);
    long wholeSeconds = (long) seconds;
    long nanos = Math.round((seconds - wholeSeconds) * NANOS_PER_SECOND);
    return Duration.ofSeconds(wholeSeconds, nanos);
  }
}
