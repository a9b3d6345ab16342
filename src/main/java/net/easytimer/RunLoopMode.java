package net.easytimer;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * Names the set of timers a run loop processes while running in that mode.
 */
public final class RunLoopMode {
  public static final RunLoopMode DEFAULT = new RunLoopMode("default");

  private final String name;

  private RunLoopMode(String name) {
    this.name = name;
  }

  public static RunLoopMode of(String name) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "mode name must not be empty");
    return DEFAULT.name.equals(name) ? DEFAULT : new RunLoopMode(name);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RunLoopMode that = (RunLoopMode) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
