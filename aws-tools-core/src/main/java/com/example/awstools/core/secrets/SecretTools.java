package com.example.awstools.core.secrets;

import static com.example.awstools.core.Params.isBlank;

import com.example.awstools.core.AwsToolsException;
import com.example.awstools.core.ErrorContext;
import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerAsyncClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Retrying access to AWS Secrets Manager values.
 *
 * <p>Secrets are fetched on every call; callers that want caching wrap the returned {@link Mono}
 * (e.g., {@code Mono#cache(Duration)}).
 */
public final class SecretTools {

  static final String COMPONENT = "SecretTools";

  private final SecretsManagerAsyncClient client;
  private final Retry.Policy policy;
  private final RetryClassifier classifier;
  private final Supplier<ObjectMapper> mapperSupplier;

  private SecretTools(final Builder builder) {
    this.client = builder.client;
    this.policy =
        builder.retryMax == null
            ? builder.retryPolicy
            : builder.retryPolicy.withMaxAttempts(builder.retryMax);
    this.classifier = builder.classifier;
    this.mapperSupplier = builder.mapperSupplier;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link SecretTools}. */
  public static class Builder {
    private SecretsManagerAsyncClient client;
    private Retry.Policy retryPolicy = Retry.Policy.defaults();
    private Integer retryMax;
    private RetryClassifier classifier = RetryClassifier.defaultClassifier();
    private Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

    /** Sets the Secrets Manager client (required). It stays owned by the caller. */
    public Builder client(final SecretsManagerAsyncClient client) {
      this.client = client;
      return this;
    }

    /** Sets the retry policy. Default: {@link Retry.Policy#defaults()} */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Overrides the number of attempts per call. */
    public Builder retryMax(final int retryMax) {
      this.retryMax = retryMax;
      return this;
    }

    /** Sets the retryability classifier. Default: {@link RetryClassifier#defaultClassifier()} */
    public Builder classifier(final RetryClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
     *
     * @param mapperSupplier the supplier of the {@link ObjectMapper} to use
     */
    public Builder mapperSupplier(final Supplier<ObjectMapper> mapperSupplier) {
      this.mapperSupplier = mapperSupplier;
      return this;
    }

    public SecretTools build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy is required");
      if (classifier == null) throw new IllegalStateException("classifier is required");
      if (mapperSupplier == null) throw new IllegalStateException("mapperSupplier is required");
      return new SecretTools(this);
    }
  }

  /**
   * Retrieves the current value of a secret.
   *
   * @param secretName the Secrets Manager secret ID or name
   * @return the raw response
   */
  public Mono<GetSecretValueResponse> getSecretValue(final String secretName) {
    final var context = context("getSecretValue", secretName);
    if (isBlank(secretName)) return Mono.error(AwsToolsException.badParam(context));
    return fetch(context, secretName);
  }

  /**
   * Retrieves the secret string of a secret.
   *
   * @param secretName the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public Mono<String> getSecretString(final String secretName) {
    final var context = context("getSecretString", secretName);
    if (isBlank(secretName)) return Mono.error(AwsToolsException.badParam(context));
    return secretString(context, secretName);
  }

  /**
   * Retrieves the version identifier of the current secret value.
   *
   * @param secretName the Secrets Manager secret ID or name
   * @return versionId of the latest secret value
   */
  public Mono<String> getSecretVersion(final String secretName) {
    final var context = context("getSecretVersion", secretName);
    if (isBlank(secretName)) return Mono.error(AwsToolsException.badParam(context));
    return fetch(context, secretName).flatMap(response -> Mono.justOrEmpty(response.versionId()));
  }

  /**
   * Retrieves a JSON secret and deserializes it with Jackson.
   *
   * @param secretName the Secrets Manager secret ID or name
   * @param type target type
   * @param <T> target type
   * @return the parsed secret
   */
  public <T> Mono<T> getSecretJson(final String secretName, final Class<T> type) {
    final var context = context("getSecretJson", secretName);
    if (isBlank(secretName) || type == null)
      return Mono.error(AwsToolsException.badParam(context));

    return secretString(context, secretName)
        .flatMap(
            secret -> {
              try {
                return Mono.justOrEmpty(mapperSupplier.get().readValue(secret, type));
              } catch (final IOException e) {
                return Mono.error(AwsToolsException.decodeFailure(context, e));
              }
            });
  }

  private Mono<String> secretString(final ErrorContext context, final String secretName) {
    return fetch(context, secretName)
        .flatMap(
            response ->
                response.secretString() == null
                    ? Mono.error(AwsToolsException.notFound(context))
                    : Mono.just(response.secretString()));
  }

  private Mono<GetSecretValueResponse> fetch(final ErrorContext context, final String secretName) {
    final var request = GetSecretValueRequest.builder().secretId(secretName).build();
    return Retry.onRetryable(
            () -> Mono.fromFuture(() -> client.getSecretValue(request)), classifier, policy)
        .onErrorMap(
            e -> AwsToolsException.unwrap(e) instanceof ResourceNotFoundException,
            e -> AwsToolsException.notFound(context, AwsToolsException.unwrap(e)))
        .onErrorMap(
            e -> !(e instanceof AwsToolsException), e -> AwsToolsException.backend(context, e));
  }

  private static ErrorContext context(final String operation, final String secretName) {
    return ErrorContext.of(COMPONENT, operation, "secretName", secretName);
  }
}
