package com.example.connectivityprobe.core;

import com.example.connectivityprobe.core.jdbc.ConnectivityProbe;
import com.example.connectivityprobe.core.jdbc.ProbeMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Probe settings resolved from system properties, falling back to environment variables.
 *
 * <ul>
 *   <li>probe.secret.name / DB_SECRET_NAME (required at execution time)
 *   <li>probe.log.group / PROBE_LOG_GROUP
 *   <li>probe.log.stream.prefix / PROBE_LOG_STREAM_PREFIX
 *   <li>probe.log.retention.days / PROBE_LOG_RETENTION_DAYS
 *   <li>probe.connect.timeout.seconds / PROBE_CONNECT_TIMEOUT_SECONDS
 *   <li>probe.mode / PROBE_MODE ({@code TRANSACTION} or {@code HEARTBEAT})
 * </ul>
 *
 * <p>Unparseable numbers and unknown modes fall back to the defaults.
 *
 * @param secretId Secrets Manager secret holding the credentials, may be {@code null}
 * @param logGroupName CloudWatch log group for per-invocation streams
 * @param streamPrefix prefix of stream names
 * @param retentionDays retention applied when the log group is created
 * @param connectTimeout connection acquisition bound
 * @param mode probe mode
 */
public record ProbeConfig(
    String secretId,
    String logGroupName,
    String streamPrefix,
    int retentionDays,
    Duration connectTimeout,
    ProbeMode mode) {

  public static final String DEFAULT_LOG_GROUP = "/aws/custom/aurora-connectivity";
  public static final String DEFAULT_STREAM_PREFIX = "execution-";
  public static final int DEFAULT_RETENTION_DAYS = 7;

  /** Reads the configuration from {@link System#getProperty} and {@link System#getenv}. */
  public static ProbeConfig fromSystem() {
    return from(System::getProperty, System::getenv);
  }

  static ProbeConfig from(
      final Function<String, String> properties, final Function<String, String> environment) {
    final var source = new Source(properties, environment);
    return new ProbeConfig(
        source.get("probe.secret.name", "DB_SECRET_NAME").orElse(null),
        source.get("probe.log.group", "PROBE_LOG_GROUP").orElse(DEFAULT_LOG_GROUP),
        source
            .get("probe.log.stream.prefix", "PROBE_LOG_STREAM_PREFIX")
            .orElse(DEFAULT_STREAM_PREFIX),
        source
            .positiveLong("probe.log.retention.days", "PROBE_LOG_RETENTION_DAYS")
            .map(Long::intValue)
            .orElse(DEFAULT_RETENTION_DAYS),
        source
            .positiveLong("probe.connect.timeout.seconds", "PROBE_CONNECT_TIMEOUT_SECONDS")
            .map(Duration::ofSeconds)
            .orElse(ConnectivityProbe.DEFAULT_CONNECT_TIMEOUT),
        source.get("probe.mode", "PROBE_MODE").flatMap(ProbeConfig::parseMode)
            .orElse(ProbeMode.TRANSACTION));
  }

  /**
   * Returns the configured secret identifier.
   *
   * @return the secret identifier
   * @throws IllegalStateException if none is configured
   */
  public String requireSecretId() {
    return Optional.ofNullable(secretId)
        .filter(id -> !id.isBlank())
        .orElseThrow(() -> new IllegalStateException("DB_SECRET_NAME is not configured"));
  }

  private static Optional<ProbeMode> parseMode(final String value) {
    try {
      return Optional.of(ProbeMode.valueOf(value.toUpperCase(Locale.ROOT)));
    } catch (final IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private record Source(Function<String, String> properties, Function<String, String> env) {

    Optional<String> get(final String property, final String variable) {
      return Optional.ofNullable(properties.apply(property))
          .or(() -> Optional.ofNullable(env.apply(variable)))
          .map(String::trim)
          .filter(val -> !val.isBlank());
    }

    Optional<Long> positiveLong(final String property, final String variable) {
      return get(property, variable)
          .flatMap(
              val -> {
                try {
                  return Optional.of(Long.parseLong(val));
                } catch (final NumberFormatException e) {
                  return Optional.empty();
                }
              })
          .filter(parsed -> parsed > 0 && parsed <= Integer.MAX_VALUE);
    }
  }
}
