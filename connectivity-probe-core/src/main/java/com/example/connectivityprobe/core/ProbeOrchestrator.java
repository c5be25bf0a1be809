package com.example.connectivityprobe.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.connectivityprobe.core.jdbc.ConnectionFactory;
import com.example.connectivityprobe.core.jdbc.ConnectivityProbe;
import com.example.connectivityprobe.core.jdbc.ProbeMode;
import com.example.connectivityprobe.core.logs.LogStreamHandle;
import com.example.connectivityprobe.core.logs.LogStreamManager;
import com.example.connectivityprobe.core.secrets.SecretResolver;
import java.lang.System.Logger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of one probe invocation.
 *
 * <p>Creates the invocation's log stream, resolves the credentials, runs the {@link
 * ConnectivityProbe} and maps the outcome to a {@link ResponseEnvelope}. {@link #execute} always
 * returns an envelope; faults that the probe did not already turn into a result (missing
 * configuration, secret failures, anything unexpected) become a 500 response.
 *
 * <pre>{@code
 * var orchestrator = ProbeOrchestrator.create(
 *     ProbeConfig.fromSystem(), AwsClients.fromSystem(), ConnectionFactory.postgres());
 *
 * var response = orchestrator.execute(Map.of());
 * }</pre>
 */
public final class ProbeOrchestrator {

  private static final Logger logger = System.getLogger(ProbeOrchestrator.class.getName());

  static final String TESTED_MESSAGE = "Successfully connected to and tested Aurora PostgreSQL";
  static final String HEARTBEAT_MESSAGE = "Successfully connected to Aurora PostgreSQL";
  static final String FAILED_MESSAGE = "Failed to connect to database";
  static final String EXECUTION_ERROR_MESSAGE = "Lambda execution error";

  private final ProbeConfig config;
  private final LogStreamManager logStreams;
  private final SecretResolver secretResolver;
  private final ConnectivityProbe probe;

  public ProbeOrchestrator(
      final ProbeConfig config,
      final LogStreamManager logStreams,
      final SecretResolver secretResolver,
      final ConnectivityProbe probe) {
    this.config = Objects.requireNonNull(config, "config");
    this.logStreams = Objects.requireNonNull(logStreams, "logStreams");
    this.secretResolver = Objects.requireNonNull(secretResolver, "secretResolver");
    this.probe = Objects.requireNonNull(probe, "probe");
  }

  /**
   * Wires the components from a configuration and the process-scoped clients.
   *
   * @param config probe settings
   * @param clients shared AWS clients
   * @param connectionFactory opens database connections
   * @return ready orchestrator
   */
  public static ProbeOrchestrator create(
      final ProbeConfig config,
      final AwsClients clients,
      final ConnectionFactory connectionFactory) {
    final var logStreams =
        LogStreamManager.builder()
            .client(clients.logs())
            .logGroupName(config.logGroupName())
            .streamPrefix(config.streamPrefix())
            .retentionDays(config.retentionDays())
            .build();
    return new ProbeOrchestrator(
        config,
        logStreams,
        new SecretResolver(clients.secrets()),
        new ConnectivityProbe(
            connectionFactory, logStreams, config.connectTimeout(), config.mode()));
  }

  /**
   * Runs one probe invocation.
   *
   * @param event invocation payload, currently unused
   * @return the response, never {@code null}
   */
  public ResponseEnvelope execute(final Map<String, Object> event) {
    final var handle = logStreams.createStream();
    final var streamName = handle.map(LogStreamHandle::streamName).orElse(null);

    try {
      final var credential = secretResolver.resolve(config.requireSecretId());
      final var result = probe.run(credential, handle);

      if (result.isSuccess()) {
        final var message =
            config.mode() == ProbeMode.HEARTBEAT ? HEARTBEAT_MESSAGE : TESTED_MESSAGE;
        logger.log(INFO, message);
        logStreams.emit(handle, message, INFO);
        return ResponseEnvelope.success(message, result, streamName);
      }

      logger.log(ERROR, FAILED_MESSAGE);
      return ResponseEnvelope.failure(FAILED_MESSAGE, result.error(), streamName);
    } catch (final VirtualMachineError e) {
      throw e;
    } catch (final Throwable e) {
      return executionError(handle, streamName, e);
    }
  }

  private ResponseEnvelope executionError(
      final Optional<LogStreamHandle> handle, final String streamName, final Throwable cause) {
    final var error = "Lambda execution failed: " + describe(cause);
    try {
      logger.log(ERROR, error, cause);
      logStreams.emit(handle, error, ERROR);
    } catch (final RuntimeException loggingFailure) {
      cause.addSuppressed(loggingFailure);
    }
    return ResponseEnvelope.failure(EXECUTION_ERROR_MESSAGE, error, streamName);
  }

  private static String describe(final Throwable e) {
    if (e instanceof ProbeException || e instanceof IllegalStateException)
      return String.valueOf(e.getMessage());
    return Optional.ofNullable(e.getMessage())
        .map(m -> e.getClass().getSimpleName() + ": " + m)
        .orElse(e.getClass().getSimpleName());
  }
}
