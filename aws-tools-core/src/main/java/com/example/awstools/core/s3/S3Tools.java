package com.example.awstools.core.s3;

import static com.example.awstools.core.Params.isBlank;

import com.example.awstools.core.AwsToolsException;
import com.example.awstools.core.ErrorContext;
import com.example.awstools.core.paging.AccumulatedResult;
import com.example.awstools.core.paging.Page;
import com.example.awstools.core.paging.PageAccumulator;
import com.example.awstools.core.paging.PageRequest;
import com.example.awstools.core.paging.PaginationException;
import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Retrying S3 object reads and writes.
 *
 * <p>Reads come in several shapes: raw bytes, UTF-8 text, a Jackson tree, or a bound type; each can
 * gunzip the body first. A read whose response carries no body, or a missing key, fails with code
 * {@code NOT_FOUND}; a body that cannot be gunzipped or parsed fails with {@code DECODE_FAILURE}.
 *
 * <pre>{@code
 * var s3 = S3Tools.builder().client(S3AsyncClient.create()).build();
 *
 * JsonNode config = s3.getObjectJson("my-bucket", "config/app.json.gz", true).block();
 * s3.putJsonObject("my-bucket", "config/app.json", Map.of("enabled", true)).block();
 * }</pre>
 */
public final class S3Tools {

  static final String COMPONENT = "S3Tools";

  private final S3AsyncClient client;
  private final Retry.Policy policy;
  private final RetryClassifier classifier;
  private final ObjectMapper mapper;

  private S3Tools(final Builder builder) {
    this.client = builder.client;
    this.policy =
        builder.retryMax == null
            ? builder.retryPolicy
            : builder.retryPolicy.withMaxAttempts(builder.retryMax);
    this.classifier = builder.classifier;
    this.mapper = builder.mapperSupplier.get();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link S3Tools}. */
  public static class Builder {
    private S3AsyncClient client;
    private Retry.Policy retryPolicy = Retry.Policy.defaults();
    private Integer retryMax;
    private RetryClassifier classifier = RetryClassifier.defaultClassifier();
    private Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

    /** Sets the S3 client (required). It stays owned by the caller. */
    public Builder client(final S3AsyncClient client) {
      this.client = client;
      return this;
    }

    /** Sets the retry policy. Default: {@link Retry.Policy#defaults()} */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Overrides the number of attempts per backend call. */
    public Builder retryMax(final int retryMax) {
      this.retryMax = retryMax;
      return this;
    }

    /** Sets the retryability classifier. Default: {@link RetryClassifier#defaultClassifier()} */
    public Builder classifier(final RetryClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /** Sets the supplier of the {@link ObjectMapper} used for JSON bodies. */
    public Builder mapperSupplier(final Supplier<ObjectMapper> mapperSupplier) {
      this.mapperSupplier = mapperSupplier;
      return this;
    }

    public S3Tools build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy is required");
      if (classifier == null) throw new IllegalStateException("classifier is required");
      if (mapperSupplier == null) throw new IllegalStateException("mapperSupplier is required");
      return new S3Tools(this);
    }
  }

  /**
   * Reads an object with its response metadata, untouched.
   *
   * @param bucket bucket name
   * @param key object key
   * @return body bytes with the {@link GetObjectResponse}
   */
  public Mono<ResponseBytes<GetObjectResponse>> getObjectResponse(
      final String bucket, final String key) {
    final var context = context("getObjectResponse", "bucket", bucket, "key", key);
    if (isBlank(bucket) || isBlank(key)) return Mono.error(AwsToolsException.badParam(context));
    return fetch(context, bucket, key);
  }

  /**
   * Reads an object body.
   *
   * @param bucket bucket name
   * @param key object key
   * @param gzip whether the body is gzip-compressed
   * @return body bytes, decompressed when {@code gzip} is set
   */
  public Mono<byte[]> getObjectBytes(final String bucket, final String key, final boolean gzip) {
    return read("getObjectBytes", bucket, key, gzip, body -> body);
  }

  /**
   * Reads an object body as UTF-8 text.
   *
   * @param bucket bucket name
   * @param key object key
   * @param gzip whether the body is gzip-compressed
   * @return body text
   */
  public Mono<String> getObjectString(final String bucket, final String key, final boolean gzip) {
    return read(
        "getObjectString", bucket, key, gzip, body -> new String(body, StandardCharsets.UTF_8));
  }

  /**
   * Reads an object body as a JSON tree.
   *
   * @param bucket bucket name
   * @param key object key
   * @param gzip whether the body is gzip-compressed
   * @return parsed JSON
   */
  public Mono<JsonNode> getObjectJson(final String bucket, final String key, final boolean gzip) {
    return read("getObjectJson", bucket, key, gzip, this::readTree);
  }

  /**
   * Reads an object body as JSON bound to {@code type}.
   *
   * @param bucket bucket name
   * @param key object key
   * @param type target type
   * @param gzip whether the body is gzip-compressed
   * @param <T> target type
   * @return deserialized body
   */
  public <T> Mono<T> getObject(
      final String bucket, final String key, final Class<T> type, final boolean gzip) {
    if (type == null) {
      final var context = context("getObject", "bucket", bucket, "key", key, "type", null);
      return Mono.error(AwsToolsException.badParam(context));
    }
    return read("getObject", bucket, key, gzip, body -> readValue(body, type));
  }

  /**
   * Serializes {@code value} with Jackson and stores it as {@code application/json}.
   *
   * @param bucket bucket name
   * @param key object key
   * @param value value to serialize
   * @return the put response
   */
  public Mono<PutObjectResponse> putJsonObject(
      final String bucket, final String key, final Object value) {
    final var context = context("putJsonObject", "bucket", bucket, "key", key);
    if (isBlank(bucket) || isBlank(key)) return Mono.error(AwsToolsException.badParam(context));

    final byte[] body;
    try {
      body = mapper.writeValueAsBytes(value);
    } catch (final JsonProcessingException e) {
      return Mono.error(AwsToolsException.decodeFailure(context, e));
    }
    return put(context, bucket, key, body, "application/json", null);
  }

  /**
   * Stores raw bytes, optionally gzip-compressing them first.
   *
   * @param bucket bucket name
   * @param key object key
   * @param body object body
   * @param contentType content type, {@code null} to let S3 default it
   * @param gzip whether to compress the body and mark it {@code Content-Encoding: gzip}
   * @return the put response
   */
  public Mono<PutObjectResponse> putObject(
      final String bucket,
      final String key,
      final byte[] body,
      final String contentType,
      final boolean gzip) {
    final var context =
        context(
            "putObject", "bucket", bucket, "key", key, "contentType", contentType, "gzip", gzip);
    if (isBlank(bucket) || isBlank(key) || body == null)
      return Mono.error(AwsToolsException.badParam(context));

    final var payload = gzip ? Gzip.compress(body) : body;
    return put(context, bucket, key, payload, contentType, gzip ? "gzip" : null);
  }

  /**
   * Lists object keys under a prefix, merging {@code ListObjectsV2} pages.
   *
   * @param bucket bucket name
   * @param prefix key prefix, {@code null} for the whole bucket
   * @param request start continuation token and optional ceiling; {@code null} lists everything
   * @return keys in lexicographic order and the last continuation token
   */
  public Mono<AccumulatedResult<String, String>> listObjectKeys(
      final String bucket, final String prefix, final PageRequest<String> request) {
    final var context =
        context(
            "listObjectKeys",
            "bucket",
            bucket,
            "prefix",
            prefix,
            "continuationToken",
            request == null ? null : request.startCursor());
    if (isBlank(bucket)) return Mono.error(AwsToolsException.badParam(context));

    final var builder = ListObjectsV2Request.builder().bucket(bucket);
    if (prefix != null) builder.prefix(prefix);
    final var list = builder.build();

    return PageAccumulator.<String, String>accumulate(
            (token, remaining) -> {
              final var page = list.toBuilder();
              if (token != null) page.continuationToken(token);
              if (remaining != null) page.maxKeys(Math.min(remaining, 1000));
              return Mono.fromFuture(() -> client.listObjectsV2(page.build()))
                  .map(
                      response ->
                          new Page<>(
                              response.hasContents()
                                  ? response.contents().stream().map(S3Object::key).toList()
                                  : null,
                              Boolean.TRUE.equals(response.isTruncated())
                                  ? response.nextContinuationToken()
                                  : null));
            },
            request == null ? PageRequest.all() : request,
            classifier,
            policy)
        .onErrorMap(e -> AwsToolsException.backend(context, causeOf(e)));
  }

  private <T> Mono<T> read(
      final String operation,
      final String bucket,
      final String key,
      final boolean gzip,
      final Function<byte[], T> converter) {
    final var context = context(operation, "bucket", bucket, "key", key, "gzip", gzip);
    if (isBlank(bucket) || isBlank(key)) return Mono.error(AwsToolsException.badParam(context));

    return fetch(context, bucket, key)
        .flatMap(
            response -> {
              try {
                final var body = response.asByteArrayUnsafe();
                return Mono.justOrEmpty(converter.apply(gzip ? Gzip.decompress(body) : body));
              } catch (final RuntimeException e) {
                return Mono.error(AwsToolsException.decodeFailure(context, e));
              }
            });
  }

  private Mono<ResponseBytes<GetObjectResponse>> fetch(
      final ErrorContext context, final String bucket, final String key) {
    final var request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    return call(
            context,
            () ->
                client.getObject(
                    request, AsyncResponseTransformer.<GetObjectResponse>toBytes()))
        .onErrorMap(
            e -> e.getCause() instanceof NoSuchKeyException,
            e -> AwsToolsException.notFound(context, e.getCause()))
        .switchIfEmpty(Mono.error(() -> AwsToolsException.notFound(context)))
        .flatMap(
            response ->
                response.asByteArrayUnsafe() == null
                    ? Mono.error(AwsToolsException.notFound(context))
                    : Mono.just(response));
  }

  private Mono<PutObjectResponse> put(
      final ErrorContext context,
      final String bucket,
      final String key,
      final byte[] body,
      final String contentType,
      final String contentEncoding) {
    final var builder = PutObjectRequest.builder().bucket(bucket).key(key);
    if (contentType != null) builder.contentType(contentType);
    if (contentEncoding != null) builder.contentEncoding(contentEncoding);
    final var request = builder.build();
    return call(context, () -> client.putObject(request, AsyncRequestBody.fromBytes(body)));
  }

  private <R> Mono<R> call(final ErrorContext context, final Supplier<CompletableFuture<R>> call) {
    return Retry.onRetryable(() -> Mono.fromFuture(call), classifier, policy)
        .onErrorMap(e -> AwsToolsException.backend(context, e));
  }

  private JsonNode readTree(final byte[] body) {
    try {
      return mapper.readTree(body);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Object body is not valid JSON", e);
    }
  }

  private <T> T readValue(final byte[] body, final Class<T> type) {
    try {
      return mapper.readValue(body, type);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Object body is not a valid " + type.getSimpleName(), e);
    }
  }

  private static Throwable causeOf(final Throwable failure) {
    return failure instanceof PaginationException && failure.getCause() != null
        ? failure.getCause()
        : failure;
  }

  private static ErrorContext context(final String operation, final Object... namesAndValues) {
    return ErrorContext.of(COMPONENT, operation, namesAndValues);
  }
}
