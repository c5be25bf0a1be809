package com.example.connectivityprobe.core;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * Process-scoped AWS clients shared by every invocation in the JVM.
 *
 * <p>Build once with {@link #fromSystem()} and pass into the components. Configuration can be
 * supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.logs.endpoint / AWS_LOGS_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 *
 * @param secrets Secrets Manager client
 * @param logs CloudWatch Logs client
 */
public record AwsClients(SecretsManagerClient secrets, CloudWatchLogsClient logs)
    implements AutoCloseable {

  /**
   * Builds both clients honoring region, endpoint and credentials overrides.
   *
   * @return configured clients
   */
  public static AwsClients fromSystem() {
    return new AwsClients(
        configure(SecretsManagerClient.builder(), "aws.sm.endpoint", "AWS_SM_ENDPOINT").build(),
        configure(CloudWatchLogsClient.builder(), "aws.logs.endpoint", "AWS_LOGS_ENDPOINT")
            .build());
  }

  private static <B extends AwsClientBuilder<B, C>, C> B configure(
      final B builder, final String endpointProperty, final String endpointVariable) {
    // Region from system property or env, default to us-east-1
    final var region =
        setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
    builder.region(region);

    setting(endpointProperty, endpointVariable).map(URI::create).ifPresent(builder::endpointOverride);

    // Credentials: use system properties if provided, else default provider chain
    setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.create()));

    return builder;
  }

  private static Optional<String> setting(final String property, final String variable) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(variable)))
        .filter(val -> !val.isBlank());
  }

  @Override
  public void close() {
    secrets.close();
    logs.close();
  }
}
