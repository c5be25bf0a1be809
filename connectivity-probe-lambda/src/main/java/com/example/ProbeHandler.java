package com.example;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.example.connectivityprobe.core.AwsClients;
import com.example.connectivityprobe.core.ProbeConfig;
import com.example.connectivityprobe.core.ProbeOrchestrator;
import com.example.connectivityprobe.core.ResponseEnvelope;
import com.example.connectivityprobe.core.jdbc.ConnectionFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.util.Map;

/**
 * AWS Lambda handler running one connectivity probe per invocation.
 *
 * <p>The runtime creates one handler per container, so the AWS clients built in the constructor
 * are reused by every invocation that container serves.
 */
public class ProbeHandler implements RequestStreamHandler {

  private static final Logger logger = System.getLogger(ProbeHandler.class.getName());

  private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {};

  private final ProbeOrchestrator orchestrator;
  private final ObjectMapper mapper = ResponseEnvelope.objectMapper();

  /** Used by the Lambda runtime. */
  public ProbeHandler() {
    this(
        ProbeOrchestrator.create(
            ProbeConfig.fromSystem(), AwsClients.fromSystem(), ConnectionFactory.postgres()));
  }

  ProbeHandler(final ProbeOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  public void handleRequest(
      final InputStream input, final OutputStream output, final Context context)
      throws IOException {
    final var response = orchestrator.execute(readEvent(input));
    mapper.writeValue(output, response);
  }

  /**
   * Entry point for running the probe outside Lambda. Prints the JSON response and exits with 0
   * on a 200 response, 1 otherwise.
   *
   * @param args CLI args (unused)
   */
  public static void main(String[] args) {
    final ResponseEnvelope response;
    try (final var clients = AwsClients.fromSystem()) {
      response =
          ProbeOrchestrator.create(ProbeConfig.fromSystem(), clients, ConnectionFactory.postgres())
              .execute(Map.of());
    }

    logger.log(DEBUG, "Probe finished with status %d".formatted(response.statusCode()));
    System.out.println(response.toJson());
    System.exit(response.statusCode() == ResponseEnvelope.OK ? 0 : 1);
  }

  private Map<String, Object> readEvent(final InputStream input) {
    try {
      final var bytes = input.readAllBytes();
      if (bytes.length == 0) return Map.of();
      final Map<String, Object> event = mapper.readValue(bytes, EVENT_TYPE);
      return event == null ? Map.of() : event;
    } catch (final IOException e) {
      // the event carries nothing the probe needs
      logger.log(WARNING, "Ignoring unreadable invocation event", e);
      return Map.of();
    }
  }
}
