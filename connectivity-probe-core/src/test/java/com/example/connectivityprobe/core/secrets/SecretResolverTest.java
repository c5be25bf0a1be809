package com.example.connectivityprobe.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.connectivityprobe.core.ProbeException;
import com.example.connectivityprobe.core.SecretAccessException;
import com.example.connectivityprobe.core.SecretFormatException;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

class SecretResolverTest {

  private static final String SECRET_ID = "prod/aurora/probe";

  private SecretsManagerClient client;
  private SecretResolver resolver;

  @BeforeEach
  void setUp() {
    client = mock(SecretsManagerClient.class);
    resolver = new SecretResolver(client);
  }

  private void secretString(final String json) {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(GetSecretValueResponse.builder().secretString(json).build());
  }

  @Nested
  @DisplayName("Valid secrets")
  class ValidSecrets {

    @Test
    @DisplayName("Should map an RDS secret to a credential record")
    void shouldMapRdsSecret() {
      secretString(
          """
          {
            "username": "probe",
            "password": "s3cret",
            "engine": "postgres",
            "host": "cluster.example.rds.amazonaws.com",
            "port": 5433,
            "dbname": "appdb"
          }
          """);

      final var record = resolver.resolve(SECRET_ID);

      assertEquals(
          new CredentialRecord(
              "cluster.example.rds.amazonaws.com", "5433", "appdb", "probe", "s3cret"),
          record);
      assertEquals(
          "jdbc:postgresql://cluster.example.rds.amazonaws.com:5433/appdb", record.jdbcUrl());
    }

    @Test
    @DisplayName("Should default the port to 5432")
    void shouldDefaultPort() {
      secretString(
          """
          {"host": "db", "dbname": "appdb", "username": "probe", "password": "s3cret"}
          """);

      assertEquals("5432", resolver.resolve(SECRET_ID).port());
    }

    @Test
    @DisplayName("Should accept the port as a string")
    void shouldAcceptStringPort() {
      secretString(
          """
          {"host": "db", "port": "6432", "dbname": "appdb", "username": "probe", "password": "pw"}
          """);

      assertEquals("6432", resolver.resolve(SECRET_ID).port());
    }

    @Test
    @DisplayName("Should request the configured secret id")
    void shouldRequestSecretId() {
      secretString(
          """
          {"host": "db", "dbname": "appdb", "username": "probe", "password": "s3cret"}
          """);

      resolver.resolve(SECRET_ID);

      verify(client).getSecretValue(GetSecretValueRequest.builder().secretId(SECRET_ID).build());
    }

    @Test
    @DisplayName("Should not print the password")
    void shouldMaskPassword() {
      final var record = new CredentialRecord("db", null, "appdb", "probe", "s3cret");

      assertFalse(record.toString().contains("s3cret"));
      assertEquals("5432", record.port());
    }
  }

  @Nested
  @DisplayName("Access failures")
  class AccessFailures {

    @Test
    @DisplayName("Should surface the AWS error code")
    void shouldSurfaceErrorCode() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenThrow(
              ResourceNotFoundException.builder()
                  .message("Secrets Manager can't find the specified secret.")
                  .awsErrorDetails(
                      AwsErrorDetails.builder().errorCode("ResourceNotFoundException").build())
                  .build());

      final var error =
          assertThrows(SecretAccessException.class, () -> resolver.resolve(SECRET_ID));

      assertEquals(ProbeException.Kind.SECRET_ACCESS, error.kind());
      assertEquals("ResourceNotFoundException", error.errorCode());
      assertTrue(
          error.getMessage().startsWith("Secrets Manager error (ResourceNotFoundException)"));
    }

    @Test
    @DisplayName("Should treat client-side SDK failures as access failures")
    void shouldWrapClientFailures() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

      final var error =
          assertThrows(SecretAccessException.class, () -> resolver.resolve(SECRET_ID));

      assertEquals("SdkClientException", error.errorCode());
    }
  }

  @Nested
  @DisplayName("Format failures")
  class FormatFailures {

    @Test
    @DisplayName("Should reject binary secrets")
    void shouldRejectBinarySecret() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(
              GetSecretValueResponse.builder()
                  .secretBinary(SdkBytes.fromUtf8String("binary"))
                  .build());

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertEquals(ProbeException.Kind.SECRET_FORMAT, error.kind());
      assertEquals("Secret binary not supported", error.getMessage());
    }

    @Test
    @DisplayName("Should reject code-like payloads instead of evaluating them")
    void shouldRejectNonJson() {
      secretString("__import__('os').system('id')");

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should reject Python-style dict literals")
    void shouldRejectDictLiteral() {
      secretString("{'host': 'db', 'dbname': 'appdb', 'username': 'u', 'password': 'p'}");

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should reject unknown fields")
    void shouldRejectUnknownFields() {
      secretString(
          """
          {"host": "db", "dbname": "appdb", "username": "u", "password": "p", "extra": true}
          """);

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertTrue(error.getMessage().contains("field 'extra'"));
    }

    @Test
    @DisplayName("Should reject duplicate fields instead of keeping the last value")
    void shouldRejectDuplicateFields() {
      secretString(
          """
          {"host": "db", "dbname": "appdb", "username": "u", "password": "p", "password": "q"}
          """);

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertEquals(ProbeException.Kind.SECRET_FORMAT, error.kind());
      assertFalse(error.getMessage().contains("\"q\""));
    }

    @Test
    @DisplayName("Should reject trailing content")
    void shouldRejectTrailingContent() {
      secretString(
          """
          {"host": "db", "dbname": "appdb", "username": "u", "password": "p"} {}
          """);

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should list every missing required field")
    void shouldRejectMissingFields() {
      secretString("""
          {"host": "db", "password": ""}
          """);

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertEquals(
          "Secret is missing required fields: [dbname, username, password]", error.getMessage());
    }

    @Test
    @DisplayName("Should reject a JSON null document")
    void shouldRejectNullDocument() {
      secretString("null");

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should reject ports outside 1..65535")
    void shouldRejectOutOfRangePort() {
      secretString(
          """
          {"host": "db", "port": 70000, "dbname": "appdb", "username": "u", "password": "p"}
          """);

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should reject non-numeric ports")
    void shouldRejectNonNumericPort() {
      secretString(
          """
          {"host": "db", "port": "pg", "dbname": "appdb", "username": "u", "password": "p"}
          """);

      assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));
    }

    @Test
    @DisplayName("Should not leak the payload into the error message")
    void shouldNotLeakPayload() {
      secretString("{\"host\": \"db\", \"password\": \"hunter2\", ");

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertFalse(error.getMessage().contains("hunter2"));
    }

    @Test
    @DisplayName("Should not quote an unquoted password back in the error")
    void shouldNotLeakUnquotedPassword() {
      secretString(
          "{\"host\": \"db\", \"dbname\": \"d\", \"username\": \"u\", \"password\": hunter2}");

      final var error =
          assertThrows(SecretFormatException.class, () -> resolver.resolve(SECRET_ID));

      assertFalse(error.getMessage().contains("hunter2"));
      assertTrue(error.getMessage().contains("at line 1, column"));
      assertNull(error.getCause(), "parser exceptions carry the raw token and are not chained");
    }
  }
}
