package net.easytimer;

import static com.google.common.base.Strings.emptyToNull;

import java.io.IOException;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import net.easytimer.util.Durations;
import org.immutables.value.Value;

@Value.Immutable
public interface Config {
  @Option("runLoop.threadName")
  String runLoopThreadName();

  @Option("runLoop.maxWait")
  Duration runLoopMaxWait();

  @Option("heartbeat.interval")
  Duration heartbeatInterval();

  static Config load() throws IOException {
    return load(Config.class.getClassLoader(), System.getenv());
  }

  /**
   * Loads the configuration from properties files found through {@code classLoader}, with
   * values in {@code env} taking precedence.
   */
  static Config load(ClassLoader classLoader, Map<String, String> env) throws IOException {
    var properties = loadProperties(classLoader);

    InvocationHandler handler = (proxy, method, args) -> {
      var option = method.getAnnotation(Option.class);
      if (option != null) {
        var valueName = option.value();
        var valueStr = readStringOption(properties, env, valueName);
        if (valueStr == null) {
          throw new IllegalStateException("missing required option: " + valueName);
        }
        return parseOption(method.getReturnType(), valueStr);
      }

      throw new UnsupportedOperationException();
    };

    // Use a temporary proxy to initialize the ImmutableConfig
    return ImmutableConfig.copyOf((Config) Proxy.newProxyInstance(
        Config.class.getClassLoader(), new Class<?>[]{Config.class}, handler));
  }

  private static Properties loadProperties(ClassLoader classLoader) throws IOException {
    var defaults = new Properties();
    try (var in = classLoader.getResourceAsStream("easytimer-defaults.properties")) {
      if (in != null) {
        defaults.load(in);
      }
    }

    var properties = new Properties(defaults);
    try (var in = classLoader.getResourceAsStream("easytimer.properties")) {
      if (in != null) {
        properties.load(in);
      }
    }

    return properties;
  }

  static String envVarName(String name) {
    return name
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('.', '_')
        .toUpperCase();
  }

  private static String readStringOption(
      Properties properties,
      Map<String, String> env,
      String name) {
    var value = emptyToNull(env.get(envVarName(name)));
    if (value != null) {
      return value;
    }

    return emptyToNull(properties.getProperty(name));
  }

  private static Object parseOption(Class<?> type, String value) {
    if (type.isAssignableFrom(String.class)) {
      return value;
    }

    if (type.isAssignableFrom(Duration.class)) {
      return Durations.fromString(value);
    }

    throw new IllegalArgumentException("unsupported type: " + type);
  }

  @Target(ElementType.METHOD)
  @Retention(RetentionPolicy.RUNTIME)
  @interface Option {
    String value();
  }
}
