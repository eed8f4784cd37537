package com.github.germanosin.lifeevents.cdc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Connection and protocol parameters of the CDC engine.
 *
 * <p>{@link #load()} reads {@code cdc.properties} from the classpath, then lets environment
 * variables override single entries (see {@link #ENVIRONMENT_KEYS}).
 */
@Value
@Builder(toBuilder = true)
public class CdcSettings {
  public static final String DEFAULT_PUBLICATION = "life_events_publication";
  public static final String DEFAULT_SLOT = "life_events_slot";
  public static final String DEFAULT_TABLE = "life_events";
  public static final String PGOUTPUT_PLUGIN = "pgoutput";

  public static final String RESOURCE = "/cdc.properties";

  public static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
      "CDC_JDBC_URL", "cdc.jdbc-url",
      "CDC_USER", "cdc.user",
      "CDC_PASSWORD", "cdc.password",
      "CDC_PUBLICATION", "cdc.publication",
      "CDC_SLOT", "cdc.slot",
      "CDC_TABLE", "cdc.table",
      "CDC_RECOVERY_BACKOFF_MS", "cdc.recovery-backoff-ms",
      "CDC_POLL_INTERVAL_MS", "cdc.poll-interval-ms"
  );

  @NonNull
  String jdbcUrl;
  String user;
  String password;

  @NonNull
  @Builder.Default
  String publicationName = DEFAULT_PUBLICATION;

  @NonNull
  @Builder.Default
  String slotName = DEFAULT_SLOT;

  @NonNull
  @Builder.Default
  String tableName = DEFAULT_TABLE;

  @NonNull
  @Builder.Default
  String plugin = PGOUTPUT_PLUGIN;

  @NonNull
  @Builder.Default
  String protoVersion = "1";

  @NonNull
  @Builder.Default
  Duration recoveryBackoff = Duration.ofSeconds(5);

  @NonNull
  @Builder.Default
  Duration pollInterval = Duration.ofMillis(10);

  @NonNull
  @Builder.Default
  String applicationName = "life-events-cdc";

  /**
   * Slot options passed when the stream starts.
   */
  public Properties slotOptions() {
    final Properties options = new Properties();
    options.putAll(Map.of(
        "proto_version", protoVersion,
        "publication_names", publicationName
    ));
    return options;
  }

  public static CdcSettings load() {
    final Properties properties = new Properties();
    try (InputStream in = CdcSettings.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + RESOURCE, e);
    }
    return fromProperties(withOverrides(properties, System.getenv()));
  }

  static Properties withOverrides(Properties properties, Map<String, String> environment) {
    final Properties merged = new Properties();
    merged.putAll(properties);
    ENVIRONMENT_KEYS.forEach((variable, key) -> {
      String value = environment.get(variable);
      if (value != null && !value.isBlank()) {
        merged.setProperty(key, value);
      }
    });
    return merged;
  }

  public static CdcSettings fromProperties(Properties properties) {
    final String jdbcUrl = properties.getProperty("cdc.jdbc-url");
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("cdc.jdbc-url is required");
    }

    final CdcSettingsBuilder builder = CdcSettings.builder()
        .jdbcUrl(jdbcUrl)
        .user(properties.getProperty("cdc.user"))
        .password(properties.getProperty("cdc.password"));

    setIfPresent(properties, "cdc.publication", builder::publicationName);
    setIfPresent(properties, "cdc.slot", builder::slotName);
    setIfPresent(properties, "cdc.table", builder::tableName);
    setIfPresent(properties, "cdc.plugin", builder::plugin);
    setIfPresent(properties, "cdc.proto-version", builder::protoVersion);
    setIfPresent(properties, "cdc.application-name", builder::applicationName);
    setIfPresent(properties, "cdc.recovery-backoff-ms",
        v -> builder.recoveryBackoff(parseMillis("cdc.recovery-backoff-ms", v)));
    setIfPresent(properties, "cdc.poll-interval-ms",
        v -> builder.pollInterval(parseMillis("cdc.poll-interval-ms", v)));

    return builder.build();
  }

  private static void setIfPresent(Properties properties, String key,
                                   Consumer<String> setter) {
    final String value = properties.getProperty(key);
    if (value != null && !value.isBlank()) {
      setter.accept(value.trim());
    }
  }

  private static Duration parseMillis(String key, String value) {
    final long millis;
    try {
      millis = Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not a number: " + value, e);
    }
    if (millis < 0) {
      throw new IllegalArgumentException(key + " must be >= 0: " + value);
    }
    return Duration.ofMillis(millis);
  }
}
