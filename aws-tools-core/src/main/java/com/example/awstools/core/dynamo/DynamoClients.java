package com.example.awstools.core.dynamo;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;

/**
 * Builds the direct DynamoDB client used as fallback behind a caching proxy.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.dynamodb.endpoint / AWS_DYNAMODB_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 */
public final class DynamoClients {

  private DynamoClients() {}

  /**
   * Builds a {@link DynamoDbAsyncClient} against the DynamoDB endpoint, honoring region, endpoint
   * and credentials overrides.
   *
   * @return configured client; the caller owns and closes it
   */
  public static DynamoDbAsyncClient directClient() {
    final var builder = DynamoDbAsyncClient.builder();

    final var region =
        setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
    builder.region(region);

    setting("aws.dynamodb.endpoint", "AWS_DYNAMODB_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    // Credentials: use system properties if provided, else default provider chain
    setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return builder.build();
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(value -> !value.isBlank())
        .map(String::trim);
  }
}
