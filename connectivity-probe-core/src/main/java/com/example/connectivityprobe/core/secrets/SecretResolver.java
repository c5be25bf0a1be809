package com.example.connectivityprobe.core.secrets;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.connectivityprobe.core.SecretAccessException;
import com.example.connectivityprobe.core.SecretFormatException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.PropertyBindingException;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * Fetches the database secret from AWS Secrets Manager and turns it into a {@link
 * CredentialRecord}.
 *
 * <p>The secret string is deserialized with Jackson into a fixed schema ({@code host}, {@code
 * port}, {@code dbname}, {@code username}, {@code password}, optionally {@code engine}). Unknown
 * or duplicate fields, trailing content, missing required fields and out-of-range ports are all
 * rejected. Format errors name the position of the fault, never the secret's content.
 */
public class SecretResolver {

  private static final Logger logger = System.getLogger(SecretResolver.class.getName());

  private final SecretsManagerClient client;
  private final ObjectMapper mapper;

  /**
   * @param client process-scoped Secrets Manager client
   */
  public SecretResolver(final SecretsManagerClient client) {
    this(client, strictMapper());
  }

  SecretResolver(final SecretsManagerClient client, final ObjectMapper mapper) {
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Mapper that refuses anything outside the secret schema. */
  static ObjectMapper strictMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
        .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
  }

  /**
   * Retrieves and validates the credentials stored under {@code secretId}.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the validated credentials
   * @throws SecretAccessException if Secrets Manager rejects or fails the request
   * @throws SecretFormatException if the secret is binary or does not match the schema
   */
  public CredentialRecord resolve(final String secretId) {
    logger.log(INFO, "Retrieving secrets for: {0}", secretId);

    final var response = fetch(secretId);
    final var secretString =
        Optional.ofNullable(response.secretString())
            .orElseThrow(() -> new SecretFormatException("Secret binary not supported"));

    final var record = parse(secretString);
    logger.log(INFO, "Successfully retrieved database secrets");
    return record;
  }

  private GetSecretValueResponse fetch(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    try {
      return client.getSecretValue(request);
    } catch (final AwsServiceException e) {
      final var code =
          Optional.ofNullable(e.awsErrorDetails())
              .map(AwsErrorDetails::errorCode)
              .orElse("Unknown");
      final var message = "Secrets Manager error (%s): %s".formatted(code, e.getMessage());
      logger.log(ERROR, message);
      throw new SecretAccessException(code, message, e);
    } catch (final SdkClientException e) {
      final var message = "Secrets Manager unreachable: %s".formatted(e.getMessage());
      logger.log(ERROR, message);
      throw new SecretAccessException("SdkClientException", message, e);
    }
  }

  CredentialRecord parse(final String secretString) {
    final SecretPayload payload;
    try {
      payload = mapper.readValue(secretString, SecretPayload.class);
    } catch (final JsonProcessingException e) {
      // Jackson messages quote the offending token, which may be the password
      throw new SecretFormatException("Secret is not a valid credential document: " + reason(e));
    }
    if (payload == null) throw new SecretFormatException("Secret is empty");

    final var missing = new ArrayList<String>();
    if (isBlank(payload.host())) missing.add("host");
    if (isBlank(payload.dbname())) missing.add("dbname");
    if (isBlank(payload.username())) missing.add("username");
    if (isBlank(payload.password())) missing.add("password");
    if (!missing.isEmpty())
      throw new SecretFormatException("Secret is missing required fields: " + missing);

    return new CredentialRecord(
        payload.host().trim(),
        validPort(payload.port()),
        payload.dbname().trim(),
        payload.username(),
        payload.password());
  }

  /** Exception type, offending field name and position; never token text. */
  static String reason(final JsonProcessingException e) {
    final var reason = new StringBuilder(e.getClass().getSimpleName());
    if (e instanceof PropertyBindingException)
      reason.append(" (field '%s')".formatted(((PropertyBindingException) e).getPropertyName()));
    Optional.ofNullable(e.getLocation())
        .ifPresent(
            l -> reason.append(" at line %d, column %d".formatted(l.getLineNr(), l.getColumnNr())));
    return reason.toString();
  }

  private static String validPort(final String port) {
    if (isBlank(port)) return CredentialRecord.DEFAULT_PORT;
    final int value;
    try {
      value = Integer.parseInt(port.trim());
    } catch (final NumberFormatException e) {
      throw new SecretFormatException("Secret port is not a number: " + port, e);
    }
    if (value < 1 || value > 65_535)
      throw new SecretFormatException("Secret port out of range: " + value);
    return Integer.toString(value);
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
