package com.example;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.connectivityprobe.core.AwsClients;
import com.example.connectivityprobe.core.ProbeConfig;
import com.example.connectivityprobe.core.ProbeOrchestrator;
import com.example.connectivityprobe.core.jdbc.ConnectionFactory;
import com.example.connectivityprobe.core.jdbc.ProbeMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * End-to-end run of the handler against a real PostgreSQL and a Localstack serving Secrets
 * Manager and CloudWatch Logs.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
public class ProbeHandlerIT {

  private static final String SECRET_ID = "it/aurora/probe";
  private static final String LOG_GROUP = "/aws/custom/aurora-connectivity";
  private static final DockerImageName LOCALSTACK_IMAGE =
      DockerImageName.parse("localstack/localstack:3");
  private static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:17");

  private PostgreSQLContainer<?> postgres;
  private GenericContainer<?> localstack;
  private AwsClients clients;

  @BeforeAll
  void setup() {
    assumeTrue(TestSupport.dockerAvailable(), "Docker not available, skipping integration test");

    postgres =
        new PostgreSQLContainer<>(POSTGRES_IMAGE)
            .withDatabaseName("testdb")
            .withUsername("testuser")
            .withPassword("testpass");
    postgres.start();

    localstack =
        new GenericContainer<>(LOCALSTACK_IMAGE)
            .withExposedPorts(4566)
            .withEnv("SERVICES", "secretsmanager,logs");
    localstack.start();

    TestSupport.configureAwsForLocalstack(localstack);
    clients = AwsClients.fromSystem();

    clients
        .secrets()
        .createSecret(
            r ->
                r.name(SECRET_ID)
                    .secretString(TestSupport.rdsSecretJson(postgres, postgres.getPassword())));
  }

  @AfterAll
  void cleanup() {
    if (clients != null) {
      try {
        clients.close();
      } catch (final Exception ignored) {
      }
    }
    TestSupport.clearAwsProperties();
    if (localstack != null) localstack.stop();
    if (postgres != null) postgres.stop();
  }

  private ProbeHandler handler(final String secretId) {
    final var config =
        new ProbeConfig(
            secretId,
            LOG_GROUP,
            ProbeConfig.DEFAULT_STREAM_PREFIX,
            ProbeConfig.DEFAULT_RETENTION_DAYS,
            Duration.ofSeconds(5),
            ProbeMode.TRANSACTION);
    return new ProbeHandler(
        ProbeOrchestrator.create(config, clients, ConnectionFactory.postgres()));
  }

  private JsonNode invoke(final ProbeHandler handler) throws Exception {
    final var output = new ByteArrayOutputStream();
    handler.handleRequest(
        new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)), output, null);
    return new ObjectMapper().readTree(output.toString(StandardCharsets.UTF_8));
  }

  @Test
  void shouldProbeRealDatabaseAndWriteStream() throws Exception {
    final var response = invoke(handler(SECRET_ID));

    assertEquals(200, response.get("statusCode").asInt());
    final var body = response.get("body");
    assertTrue(body.get("version").asText().startsWith("PostgreSQL"));
    final var id = body.get("testRecord").get("id").asLong();
    assertEquals(id, body.get("deletedRecordId").asLong());
    assertEquals("Lambda connectivity test", body.get("testRecord").get("text").asText());

    final var streamName = body.get("logStream").asText();
    final var events =
        clients.logs().getLogEvents(r -> r.logGroupName(LOG_GROUP).logStreamName(streamName));
    assertTrue(
        events.events().stream()
            .anyMatch(e -> e.message().startsWith("[INFO] Database version: PostgreSQL")));
  }

  @Test
  void shouldGiveImmediateInvocationsDistinctStreams() throws Exception {
    final var handler = handler(SECRET_ID);

    final var first = invoke(handler).get("body").get("logStream").asText();
    final var second = invoke(handler).get("body").get("logStream").asText();

    assertNotEquals(first, second);
  }

  @Test
  void shouldReturn500ForUnknownSecret() throws Exception {
    final var response = invoke(handler("it/does-not-exist"));

    assertEquals(500, response.get("statusCode").asInt());
    assertTrue(response.get("body").get("error").asText().contains("ResourceNotFoundException"));
  }

  @Test
  void shouldReturn500WhenPasswordIsWrong() throws Exception {
    final var wrongSecret = "it/aurora/wrong-password";
    clients
        .secrets()
        .createSecret(
            r -> r.name(wrongSecret).secretString(TestSupport.rdsSecretJson(postgres, "nope")));

    final var response = invoke(handler(wrongSecret));

    assertEquals(500, response.get("statusCode").asInt());
    assertTrue(
        response.get("body").get("error").asText().startsWith("Database connection failed:"));
    assertFalse(response.get("body").has("testRecord"));
  }

  @Test
  void shouldRunFromSystemConfiguration() {
    System.setProperty("probe.secret.name", SECRET_ID);
    try {
      final var response =
          ProbeOrchestrator.create(ProbeConfig.fromSystem(), clients, ConnectionFactory.postgres())
              .execute(Map.of());
      assertEquals(200, response.statusCode());
    } finally {
      System.clearProperty("probe.secret.name");
    }
  }
}
