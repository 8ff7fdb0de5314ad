package io.sweepnotify.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings.
 *
 * <p>Each key is looked up as a JVM system property, then as an environment variable (upper
 * case, {@code .} and {@code -} replaced by {@code _}, so {@code sweepnotify.zone} becomes {@code
 * SWEEPNOTIFY_ZONE}), then in the classpath resource {@value #RESOURCE}, then falls back to the
 * built-in default.
 *
 * @param zone the civil time zone all schedules are evaluated in
 * @param activeHorizon how soon an occurrence must start to count as imminent
 * @param upcomingHorizon how soon a next reminder must be due to count as upcoming
 * @param catalogTtl how long a loaded segment catalog is reused
 * @param catalogPath where the segment catalog file lives
 * @param alertsUrl link appended to outbound reminders
 */
public record EngineConfig(
    ZoneId zone,
    Duration activeHorizon,
    Duration upcomingHorizon,
    Duration catalogTtl,
    Path catalogPath,
    String alertsUrl) {
  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  /** Classpath resource holding the packaged settings. */
  public static final String RESOURCE = "sweepnotify.properties";

  static final String ZONE = "sweepnotify.zone";
  static final String ACTIVE_HORIZON = "sweepnotify.active-horizon";
  static final String UPCOMING_HORIZON = "sweepnotify.upcoming-horizon";
  static final String CATALOG_TTL = "sweepnotify.catalog.ttl";
  static final String CATALOG_PATH = "sweepnotify.catalog.path";
  static final String ALERTS_URL = "sweepnotify.alerts-url";

  public EngineConfig {
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(activeHorizon, "activeHorizon");
    Objects.requireNonNull(upcomingHorizon, "upcomingHorizon");
    Objects.requireNonNull(catalogTtl, "catalogTtl");
    Objects.requireNonNull(catalogPath, "catalogPath");
    Objects.requireNonNull(alertsUrl, "alertsUrl");
    if (activeHorizon.isNegative() || upcomingHorizon.isNegative() || catalogTtl.isNegative()) {
      throw new IllegalArgumentException("durations must not be negative");
    }
  }

  /**
   * Returns the built-in settings without reading anything.
   *
   * @return the defaults
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        ZoneId.of("America/Los_Angeles"),
        Duration.ofHours(2),
        Duration.ofHours(48),
        Duration.ofMinutes(1),
        Path.of("data/street-segments.json"),
        "https://sweepnotify.io/notifications");
  }

  /**
   * Loads the settings from system properties, the environment and {@value #RESOURCE}.
   *
   * @return the settings
   * @throws IllegalArgumentException if a value is malformed
   */
  public static EngineConfig load() {
    return load(loadResource(), System.getProperties(), System.getenv());
  }

  static EngineConfig load(Properties resource, Properties system, Map<String, String> env) {
    Function<String, String> lookup =
        key -> {
          String value = system.getProperty(key);
          if (isBlank(value)) {
            value = env.get(envName(key));
          }
          if (isBlank(value)) {
            value = resource.getProperty(key);
          }
          return isBlank(value) ? null : value.trim();
        };

    EngineConfig d = defaults();
    EngineConfig config =
        new EngineConfig(
            parse(lookup, ZONE, ZoneId::of, d.zone()),
            parse(lookup, ACTIVE_HORIZON, Duration::parse, d.activeHorizon()),
            parse(lookup, UPCOMING_HORIZON, Duration::parse, d.upcomingHorizon()),
            parse(lookup, CATALOG_TTL, Duration::parse, d.catalogTtl()),
            parse(lookup, CATALOG_PATH, Path::of, d.catalogPath()),
            parse(lookup, ALERTS_URL, Function.identity(), d.alertsUrl()));
    log.debug("Loaded {}", config);
    return config;
  }

  static String envName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  private static <T> T parse(
      Function<String, String> lookup, String key, Function<String, T> parser, T fallback) {
    String raw = lookup.apply(key);
    if (raw == null) {
      return fallback;
    }
    try {
      return parser.apply(raw);
    } catch (DateTimeException | IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid value for " + key + ": " + raw, e);
    }
  }

  private static Properties loadResource() {
    Properties props = new Properties();
    try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("{} not found on classpath, using defaults", RESOURCE);
        return props;
      }
      props.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read " + RESOURCE, e);
    }
    return props;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
