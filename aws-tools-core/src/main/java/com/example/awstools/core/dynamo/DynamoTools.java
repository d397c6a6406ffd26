package com.example.awstools.core.dynamo;

import static com.example.awstools.core.Params.isBlank;
import static com.example.awstools.core.Params.isEmpty;
import static com.example.awstools.core.Params.sizeOf;

import com.example.awstools.core.AwsToolsException;
import com.example.awstools.core.ErrorContext;
import com.example.awstools.core.paging.AccumulatedResult;
import com.example.awstools.core.paging.Page;
import com.example.awstools.core.paging.PageRequest;
import com.example.awstools.core.retry.Retry;
import com.example.awstools.core.retry.RetryClassifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.Get;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactGetItem;
import software.amazon.awssdk.services.dynamodb.model.TransactGetItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Retrying, paginating DynamoDB operations.
 *
 * <p>Every operation validates its arguments before calling DynamoDB and emits an {@link
 * AwsToolsException} with code {@code BAD_PARAM} when they are invalid. Transient failures (those
 * DynamoDB flags as retryable) are retried with exponential backoff; query and scan results are
 * merged across pages.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var dynamo = DynamoTools.builder().client(DynamoDbAsyncClient.create()).build();
 *
 * var orders = dynamo.queryHashKey("orders", "customerId", "c-42", PageRequest.all()).block();
 * orders.items().forEach(System.out::println);
 * }</pre>
 *
 * <h2>Behind A Caching Proxy</h2>
 *
 * <pre>{@code
 * var dynamo = DynamoTools.builder()
 *     .client(daxClient)
 *     .clientKind(ClientKind.CACHE_PROXY)
 *     .retryMax(3)
 *     .build();
 * }</pre>
 *
 * <p>When the DAX client exhausts its retries, the operation continues on a direct DynamoDB client
 * built by {@link DynamoClients#directClient()} (or the one given to {@link
 * Builder#fallbackClient}).
 */
public final class DynamoTools implements AutoCloseable {

  static final String COMPONENT = "DynamoTools";

  static final int MAX_BATCH_GET_KEYS = 100;
  static final int MAX_BATCH_WRITES = 25;
  static final int MAX_TRANSACT_ITEMS = 100;

  private final BackendSubstitution backend;

  private DynamoTools(final Builder builder) {
    final var policy =
        builder.retryMax == null
            ? builder.retryPolicy
            : builder.retryPolicy.withMaxAttempts(builder.retryMax);
    final var ownsFallback = builder.fallbackClient == null;
    final Supplier<DynamoDbAsyncClient> fallbackFactory =
        ownsFallback ? DynamoClients::directClient : () -> builder.fallbackClient;
    this.backend =
        new BackendSubstitution(
            builder.client,
            builder.clientKind,
            fallbackFactory,
            ownsFallback,
            builder.classifier,
            policy,
            Objects.requireNonNullElseGet(
                builder.logger, () -> System.getLogger(DynamoTools.class.getName())));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link DynamoTools}. */
  public static class Builder {
    private DynamoDbAsyncClient client;
    private ClientKind clientKind = ClientKind.DIRECT;
    private DynamoDbAsyncClient fallbackClient;
    private Retry.Policy retryPolicy = Retry.Policy.defaults();
    private Integer retryMax;
    private RetryClassifier classifier = RetryClassifier.defaultClassifier();
    private System.Logger logger;

    /**
     * Sets the primary client (required). It stays owned by the caller.
     *
     * @param client DynamoDB or DAX async client
     * @return this builder
     */
    public Builder client(final DynamoDbAsyncClient client) {
      this.client = client;
      return this;
    }

    /**
     * Declares what the primary client talks to.
     *
     * <p>Default: {@link ClientKind#DIRECT}
     *
     * @param clientKind kind of the primary client
     * @return this builder
     */
    public Builder clientKind(final ClientKind clientKind) {
      this.clientKind = clientKind;
      return this;
    }

    /**
     * Sets the direct client used when a caching-proxy primary gives up. It stays owned by the
     * caller.
     *
     * <p>Default: built on first use by {@link DynamoClients#directClient()}
     *
     * @param fallbackClient direct DynamoDB client
     * @return this builder
     */
    public Builder fallbackClient(final DynamoDbAsyncClient fallbackClient) {
      this.fallbackClient = fallbackClient;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Default: {@link Retry.Policy#defaults()}
     *
     * @param retryPolicy policy applied to each backend call
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Overrides the number of attempts per backend call.
     *
     * @param retryMax attempts including the first
     * @return this builder
     */
    public Builder retryMax(final int retryMax) {
      this.retryMax = retryMax;
      return this;
    }

    /**
     * Sets the retryability classifier.
     *
     * <p>Default: {@link RetryClassifier#defaultClassifier()}
     *
     * @param classifier classifier for backend failures
     * @return this builder
     */
    public Builder classifier(final RetryClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the logger receiving fallback events.
     *
     * @param logger logger for fallback diagnostics
     * @return this builder
     */
    public Builder logger(final System.Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Builds the tools.
     *
     * @return configured DynamoTools
     * @throws IllegalStateException if required fields are not set
     * @throws IllegalArgumentException if {@code retryMax} is below 1
     */
    public DynamoTools build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (clientKind == null) throw new IllegalStateException("clientKind is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy is required");
      if (classifier == null) throw new IllegalStateException("classifier is required");
      return new DynamoTools(this);
    }
  }

  /**
   * Queries all items sharing a hash key.
   *
   * @param table table name
   * @param hashKeyName hash key attribute name
   * @param hashKeyValue hash key value (string attribute)
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return items in key order and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>>
      queryHashKey(
          final String table,
          final String hashKeyName,
          final String hashKeyValue,
          final PageRequest<Map<String, AttributeValue>> request) {
    return queryHashKey(
        table,
        hashKeyName,
        hashKeyValue == null ? null : AttributeValue.fromS(hashKeyValue),
        request);
  }

  /**
   * Queries all items sharing a hash key.
   *
   * @param table table name
   * @param hashKeyName hash key attribute name
   * @param hashKeyValue hash key value
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return items in key order and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>>
      queryHashKey(
          final String table,
          final String hashKeyName,
          final AttributeValue hashKeyValue,
          final PageRequest<Map<String, AttributeValue>> request) {
    final var context =
        context(
            "queryHashKey",
            "table",
            table,
            "hashKeyName",
            hashKeyName,
            "hashKeyValue",
            hashKeyValue,
            "exclusiveStartKey",
            startKey(request));
    if (isBlank(table) || isBlank(hashKeyName) || hashKeyValue == null)
      return Mono.error(AwsToolsException.badParam(context));

    return query(
        context, table, null, List.of(KeyCondition.eq(hashKeyName, hashKeyValue)), request);
  }

  /**
   * Queries a table with a conjunction of key conditions.
   *
   * @param table table name
   * @param conditions key conditions, at least one
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return matching items and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>> query(
      final String table,
      final List<KeyCondition> conditions,
      final PageRequest<Map<String, AttributeValue>> request) {
    return query(table, null, conditions, request);
  }

  /**
   * Queries a table or one of its secondary indexes with a conjunction of key conditions.
   *
   * @param table table name
   * @param indexName secondary index name, {@code null} for the table itself
   * @param conditions key conditions, at least one
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return matching items and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>> query(
      final String table,
      final String indexName,
      final List<KeyCondition> conditions,
      final PageRequest<Map<String, AttributeValue>> request) {
    final var context =
        context(
            "query",
            "table",
            table,
            "indexName",
            indexName,
            "conditions",
            conditions,
            "exclusiveStartKey",
            startKey(request));
    if (isBlank(table) || isEmpty(conditions) || conditions.stream().anyMatch(Objects::isNull))
      return Mono.error(AwsToolsException.badParam(context));

    return query(context, table, indexName, conditions, request);
  }

  private Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>> query(
      final ErrorContext context,
      final String table,
      final String indexName,
      final List<KeyCondition> conditions,
      final PageRequest<Map<String, AttributeValue>> request) {
    final var expression =
        ConditionExpressions.render(ConditionExpressions.KEY_PREFIX, conditions);
    final var builder =
        QueryRequest.builder()
            .tableName(table)
            .keyConditionExpression(expression.expression())
            .expressionAttributeNames(expression.names())
            .expressionAttributeValues(expression.values());
    if (indexName != null) builder.indexName(indexName);
    final var query = builder.build();

    return backend.paginate(
        context,
        (client, cursor, remaining) -> {
          final var page = query.toBuilder();
          if (cursor != null) page.exclusiveStartKey(cursor);
          if (remaining != null) page.limit(remaining);
          return Mono.fromFuture(() -> client.query(page.build()))
              .map(
                  response ->
                      new Page<>(
                          response.hasItems() ? response.items() : null,
                          cursorOf(response.hasLastEvaluatedKey(), response.lastEvaluatedKey())));
        },
        orAll(request));
  }

  /**
   * Scans a whole table.
   *
   * @param table table name
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return items and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>> scan(
      final String table, final PageRequest<Map<String, AttributeValue>> request) {
    return scan(table, List.of(), request);
  }

  /**
   * Scans a table, keeping items matching every filter.
   *
   * @param table table name
   * @param filters filter conditions; empty for a full scan
   * @param request start key and optional ceiling; {@code null} reads everything
   * @return matching items and the last evaluated key
   */
  public Mono<AccumulatedResult<Map<String, AttributeValue>, Map<String, AttributeValue>>> scan(
      final String table,
      final List<KeyCondition> filters,
      final PageRequest<Map<String, AttributeValue>> request) {
    final var context =
        context("scan", "table", table, "filters", filters, "exclusiveStartKey", startKey(request));
    if (isBlank(table) || filters == null || filters.stream().anyMatch(Objects::isNull))
      return Mono.error(AwsToolsException.badParam(context));

    final var builder = ScanRequest.builder().tableName(table);
    if (!filters.isEmpty()) {
      final var expression = ConditionExpressions.render(ConditionExpressions.KEY_PREFIX, filters);
      builder
          .filterExpression(expression.expression())
          .expressionAttributeNames(expression.names())
          .expressionAttributeValues(expression.values());
    }
    final var scan = builder.build();

    return backend.paginate(
        context,
        (client, cursor, remaining) -> {
          final var page = scan.toBuilder();
          if (cursor != null) page.exclusiveStartKey(cursor);
          if (remaining != null) page.limit(remaining);
          return Mono.fromFuture(() -> client.scan(page.build()))
              .map(
                  response ->
                      new Page<>(
                          response.hasItems() ? response.items() : null,
                          cursorOf(response.hasLastEvaluatedKey(), response.lastEvaluatedKey())));
        },
        orAll(request));
  }

  /**
   * Reads one item by primary key.
   *
   * @param table table name
   * @param key full primary key
   * @return the item, or an empty {@code Mono} when it does not exist
   */
  public Mono<Map<String, AttributeValue>> getItem(
      final String table, final Map<String, AttributeValue> key) {
    final var context = context("getItem", "table", table, "key", key);
    if (isBlank(table) || isEmpty(key)) return Mono.error(AwsToolsException.badParam(context));

    final var request = GetItemRequest.builder().tableName(table).key(key).build();
    return backend
        .call(context, client -> client.getItem(request))
        .flatMap(
            response ->
                response.hasItem() && !response.item().isEmpty()
                    ? Mono.just(response.item())
                    : Mono.empty());
  }

  /**
   * Writes an item, replacing any item with the same key.
   *
   * @param table table name
   * @param item item including its primary key
   * @return completion signal
   */
  public Mono<Void> putItem(final String table, final Map<String, AttributeValue> item) {
    final var context = context("putItem", "table", table, "item", item);
    if (isBlank(table) || item == null) return Mono.error(AwsToolsException.badParam(context));

    final var request = PutItemRequest.builder().tableName(table).item(item).build();
    return backend.call(context, client -> client.putItem(request)).then();
  }

  /**
   * Updates attributes of an item, optionally only when its stored state matches conditions.
   *
   * @param table table name
   * @param key full primary key
   * @param update attributes to set and increment, with optional conditions
   * @return all attributes of the item after the update
   */
  public Mono<Map<String, AttributeValue>> updateItem(
      final String table, final Map<String, AttributeValue> key, final ItemUpdate update) {
    final var context = context("updateItem", "table", table, "key", key, "update", update);
    if (isBlank(table) || isEmpty(key) || update == null || update.isEmpty())
      return Mono.error(AwsToolsException.badParam(context));

    final var expression = update.render();
    final var names = new LinkedHashMap<>(expression.names());
    final var values = new LinkedHashMap<>(expression.values());
    final var builder =
        UpdateItemRequest.builder()
            .tableName(table)
            .key(key)
            .updateExpression(expression.expression())
            .returnValues(ReturnValue.ALL_NEW);
    if (!update.conditions().isEmpty()) {
      final var condition =
          ConditionExpressions.render(ConditionExpressions.CONDITION_PREFIX, update.conditions());
      names.putAll(condition.names());
      values.putAll(condition.values());
      builder.conditionExpression(condition.expression());
    }
    final var request =
        builder.expressionAttributeNames(names).expressionAttributeValues(values).build();

    return backend
        .call(context, client -> client.updateItem(request))
        .map(
            response ->
                response.hasAttributes()
                    ? response.attributes()
                    : Map.<String, AttributeValue>of());
  }

  /**
   * Deletes an item by primary key. Deleting a missing item succeeds.
   *
   * @param table table name
   * @param key full primary key
   * @return completion signal
   */
  public Mono<Void> deleteItem(final String table, final Map<String, AttributeValue> key) {
    final var context = context("deleteItem", "table", table, "key", key);
    if (isBlank(table) || isEmpty(key)) return Mono.error(AwsToolsException.badParam(context));

    final var request = DeleteItemRequest.builder().tableName(table).key(key).build();
    return backend.call(context, client -> client.deleteItem(request)).then();
  }

  /**
   * Reads up to 100 items of one table in a single batch.
   *
   * @param table table name
   * @param keys primary keys
   * @return the items found, in no particular order; empty when the response has none for the
   *     table
   */
  public Mono<List<Map<String, AttributeValue>>> batchGetItems(
      final String table, final List<Map<String, AttributeValue>> keys) {
    final var context = context("batchGetItems", "table", table, "keys", keys);
    if (isBlank(table)
        || isEmpty(keys)
        || keys.size() > MAX_BATCH_GET_KEYS
        || keys.stream().anyMatch(key -> isEmpty(key)))
      return Mono.error(AwsToolsException.badParam(context));

    final var request =
        BatchGetItemRequest.builder()
            .requestItems(Map.of(table, KeysAndAttributes.builder().keys(keys).build()))
            .build();
    return backend
        .call(context, client -> client.batchGetItem(request))
        .map(response -> itemsOf(response.hasResponses() ? response.responses().get(table) : null));
  }

  /**
   * Writes and deletes up to 25 items of one table in a single batch.
   *
   * @param table table name
   * @param puts items to write, may be empty
   * @param deleteKeys primary keys to delete, may be empty
   * @return write requests DynamoDB left unprocessed for the table, empty when all were applied
   */
  public Mono<List<WriteRequest>> batchWriteItems(
      final String table,
      final List<Map<String, AttributeValue>> puts,
      final List<Map<String, AttributeValue>> deleteKeys) {
    final var context =
        context("batchWriteItems", "table", table, "puts", puts, "deleteKeys", deleteKeys);
    final var total = sizeOf(puts) + sizeOf(deleteKeys);
    if (isBlank(table) || total == 0 || total > MAX_BATCH_WRITES || hasEmpty(puts, deleteKeys))
      return Mono.error(AwsToolsException.badParam(context));

    final var writes = new ArrayList<WriteRequest>(total);
    for (final var item : orEmpty(puts))
      writes.add(
          WriteRequest.builder().putRequest(PutRequest.builder().item(item).build()).build());
    for (final var key : orEmpty(deleteKeys))
      writes.add(
          WriteRequest.builder().deleteRequest(DeleteRequest.builder().key(key).build()).build());

    final var request = BatchWriteItemRequest.builder().requestItems(Map.of(table, writes)).build();
    return backend
        .call(context, client -> client.batchWriteItem(request))
        .map(
            response -> {
              if (!response.hasUnprocessedItems()) return List.<WriteRequest>of();
              final var unprocessed = response.unprocessedItems().get(table);
              return unprocessed == null ? List.<WriteRequest>of() : List.copyOf(unprocessed);
            });
  }

  /**
   * Reads up to 100 items of one table in a single serializable transaction.
   *
   * @param table table name
   * @param keys primary keys
   * @return the items found, in key order; missing items are skipped
   */
  public Mono<List<Map<String, AttributeValue>>> transactGetItems(
      final String table, final List<Map<String, AttributeValue>> keys) {
    final var context = context("transactGetItems", "table", table, "keys", keys);
    if (isBlank(table)
        || isEmpty(keys)
        || keys.size() > MAX_TRANSACT_ITEMS
        || keys.stream().anyMatch(key -> isEmpty(key)))
      return Mono.error(AwsToolsException.badParam(context));

    final var gets =
        keys.stream()
            .map(
                key ->
                    TransactGetItem.builder()
                        .get(Get.builder().tableName(table).key(key).build())
                        .build())
            .toList();
    final var request = TransactGetItemsRequest.builder().transactItems(gets).build();
    return backend
        .call(context, client -> client.transactGetItems(request))
        .map(response -> transactItemsOf(response.hasResponses() ? response.responses() : null));
  }

  /**
   * Writes and deletes up to 100 items of one table atomically.
   *
   * @param table table name
   * @param puts items to write, may be empty
   * @param deleteKeys primary keys to delete, may be empty
   * @return completion signal
   */
  public Mono<Void> transactWriteItems(
      final String table,
      final List<Map<String, AttributeValue>> puts,
      final List<Map<String, AttributeValue>> deleteKeys) {
    final var context =
        context("transactWriteItems", "table", table, "puts", puts, "deleteKeys", deleteKeys);
    final var total = sizeOf(puts) + sizeOf(deleteKeys);
    if (isBlank(table) || total == 0 || total > MAX_TRANSACT_ITEMS || hasEmpty(puts, deleteKeys))
      return Mono.error(AwsToolsException.badParam(context));

    final var writes = new ArrayList<TransactWriteItem>(total);
    for (final var item : orEmpty(puts))
      writes.add(
          TransactWriteItem.builder()
              .put(Put.builder().tableName(table).item(item).build())
              .build());
    for (final var key : orEmpty(deleteKeys))
      writes.add(
          TransactWriteItem.builder()
              .delete(Delete.builder().tableName(table).key(key).build())
              .build());

    final var request = TransactWriteItemsRequest.builder().transactItems(writes).build();
    return backend.call(context, client -> client.transactWriteItems(request)).then();
  }

  /** Closes the fallback client if these tools built it. Caller-supplied clients stay open. */
  @Override
  public void close() {
    backend.close();
  }

  private static ErrorContext context(final String operation, final Object... namesAndValues) {
    return ErrorContext.of(COMPONENT, operation, namesAndValues);
  }

  private static Map<String, AttributeValue> startKey(
      final PageRequest<Map<String, AttributeValue>> request) {
    return request == null ? null : request.startCursor();
  }

  private static <C> PageRequest<C> orAll(final PageRequest<C> request) {
    return request == null ? PageRequest.all() : request;
  }

  private static Map<String, AttributeValue> cursorOf(
      final boolean present, final Map<String, AttributeValue> lastEvaluatedKey) {
    return present && !lastEvaluatedKey.isEmpty() ? lastEvaluatedKey : null;
  }

  private static List<Map<String, AttributeValue>> itemsOf(
      final List<Map<String, AttributeValue>> items) {
    if (items == null) return List.of();
    return items.stream().filter(Objects::nonNull).toList();
  }

  private static List<Map<String, AttributeValue>> transactItemsOf(
      final List<ItemResponse> responses) {
    if (responses == null) return List.of();
    return responses.stream()
        .filter(Objects::nonNull)
        .filter(ItemResponse::hasItem)
        .map(ItemResponse::item)
        .filter(item -> !item.isEmpty())
        .toList();
  }

  private static <T> List<T> orEmpty(final List<T> list) {
    return list == null ? List.of() : list;
  }

  private static boolean hasEmpty(
      final List<Map<String, AttributeValue>> puts,
      final List<Map<String, AttributeValue>> deleteKeys) {
    return orEmpty(puts).stream().anyMatch(item -> isEmpty(item))
        || orEmpty(deleteKeys).stream().anyMatch(key -> isEmpty(key));
  }
}
