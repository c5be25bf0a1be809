package com.example.connectivityprobe.core.logs;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.connectivityprobe.core.LogServiceException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogGroupRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutRetentionPolicyRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

/**
 * Best-effort owner of the per-invocation CloudWatch Logs stream.
 *
 * <p>Nothing in this class throws to its caller: stream creation yields {@link Optional#empty()}
 * on failure and emission silently degrades to the local process log.
 *
 * <pre>{@code
 * var streams = LogStreamManager.builder()
 *     .client(clients.logs())
 *     .logGroupName("/aws/custom/aurora-connectivity")
 *     .retentionDays(7)
 *     .build();
 *
 * var handle = streams.createStream();
 * streams.emit(handle, "Attempting to connect", Level.INFO);
 * }</pre>
 */
public final class LogStreamManager {

  private static final Logger logger = System.getLogger(LogStreamManager.class.getName());

  private static final DateTimeFormatter STREAM_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  private final CloudWatchLogsClient client;
  private final String logGroupName;
  private final String streamPrefix;
  private final int retentionDays;
  private final Clock clock;
  private final Supplier<String> suffixSupplier;

  private LogStreamManager(final Builder builder) {
    this.client = builder.client;
    this.logGroupName = builder.logGroupName;
    this.streamPrefix = builder.streamPrefix;
    this.retentionDays = builder.retentionDays;
    this.clock = builder.clock;
    this.suffixSupplier = builder.suffixSupplier;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link LogStreamManager}. */
  public static class Builder {
    private CloudWatchLogsClient client;
    private String logGroupName = "/aws/custom/aurora-connectivity";
    private String streamPrefix = "execution-";
    private int retentionDays = 7;
    private Clock clock = Clock.systemUTC();
    private Supplier<String> suffixSupplier =
        () -> UUID.randomUUID().toString().replace("-", "").substring(0, 12);

    private Builder() {}

    /**
     * Sets the CloudWatch Logs client (required).
     *
     * @param client process-scoped client
     * @return this builder
     */
    public Builder client(final CloudWatchLogsClient client) {
      this.client = client;
      return this;
    }

    public Builder logGroupName(final String logGroupName) {
      this.logGroupName = logGroupName;
      return this;
    }

    public Builder streamPrefix(final String streamPrefix) {
      this.streamPrefix = streamPrefix;
      return this;
    }

    /**
     * Sets the retention applied when this manager creates the log group.
     *
     * <p>Default: 7 days
     *
     * @param retentionDays retention in days
     * @return this builder
     */
    public Builder retentionDays(final int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the source of the random part of stream names.
     *
     * @param suffixSupplier returns a fresh suffix per call
     * @return this builder
     */
    public Builder suffixSupplier(final Supplier<String> suffixSupplier) {
      this.suffixSupplier = suffixSupplier;
      return this;
    }

    /**
     * Builds the manager.
     *
     * @return configured manager
     * @throws IllegalStateException if required fields are missing
     */
    public LogStreamManager build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (logGroupName == null || logGroupName.isBlank())
        throw new IllegalStateException("logGroupName is required");
      if (streamPrefix == null) throw new IllegalStateException("streamPrefix cannot be null");
      if (retentionDays < 1) throw new IllegalArgumentException("retentionDays must be >= 1");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (suffixSupplier == null) throw new IllegalStateException("suffixSupplier cannot be null");
      return new LogStreamManager(this);
    }
  }

  /**
   * Creates the stream for this invocation, creating the log group first if needed.
   *
   * @return the new stream, or empty if any CloudWatch call failed
   */
  public Optional<LogStreamHandle> createStream() {
    try {
      final var streamName = nextStreamName();
      if (ensureLogGroup()) applyRetention();
      createLogStream(streamName);
      logger.log(DEBUG, "Created log stream {0} in {1}", streamName, logGroupName);
      return Optional.of(new LogStreamHandle(logGroupName, streamName));
    } catch (final RuntimeException e) {
      logger.log(ERROR, "Failed to create custom log stream: " + e.getMessage(), e);
      return Optional.empty();
    }
  }

  /**
   * Sends one {@code "[LEVEL] message"} event to the stream. No-op when {@code handle} is empty.
   *
   * @param handle the invocation's stream, possibly absent
   * @param message the event text
   * @param level severity rendered into the event text
   */
  public void emit(
      final Optional<LogStreamHandle> handle, final String message, final Level level) {
    handle.ifPresent(
        h -> {
          try {
            putEvent(h, "[%s] %s".formatted(level.getName(), message));
          } catch (final RuntimeException e) {
            logger.log(ERROR, "Failed to write to custom CloudWatch: " + e.getMessage(), e);
          }
        });
  }

  String nextStreamName() {
    return streamPrefix + STREAM_TIMESTAMP.format(clock.instant()) + "-" + suffixSupplier.get();
  }

  /**
   * @return true if the group was created by this call, false if it already existed
   */
  boolean ensureLogGroup() {
    try {
      client.createLogGroup(CreateLogGroupRequest.builder().logGroupName(logGroupName).build());
      logger.log(INFO, "Created log group {0}", logGroupName);
      return true;
    } catch (final ResourceAlreadyExistsException e) {
      return false;
    } catch (final SdkException e) {
      throw new LogServiceException("CreateLogGroup failed for " + logGroupName, e);
    }
  }

  private void applyRetention() {
    try {
      client.putRetentionPolicy(
          PutRetentionPolicyRequest.builder()
              .logGroupName(logGroupName)
              .retentionInDays(retentionDays)
              .build());
    } catch (final SdkException e) {
      throw new LogServiceException("PutRetentionPolicy failed for " + logGroupName, e);
    }
  }

  void createLogStream(final String streamName) {
    try {
      client.createLogStream(
          CreateLogStreamRequest.builder()
              .logGroupName(logGroupName)
              .logStreamName(streamName)
              .build());
    } catch (final SdkException e) {
      throw new LogServiceException("CreateLogStream failed for " + streamName, e);
    }
  }

  void putEvent(final LogStreamHandle handle, final String message) {
    final var event =
        InputLogEvent.builder().timestamp(clock.millis()).message(message).build();
    try {
      client.putLogEvents(
          PutLogEventsRequest.builder()
              .logGroupName(handle.logGroupName())
              .logStreamName(handle.streamName())
              .logEvents(event)
              .build());
    } catch (final SdkException e) {
      throw new LogServiceException("PutLogEvents failed for " + handle.streamName(), e);
    }
  }
}
