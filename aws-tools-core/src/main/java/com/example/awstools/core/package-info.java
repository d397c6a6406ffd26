/**
 * Root package for the aws-tools library.
 *
 * <p>This package and its subpackages wrap the AWS SDK v2 async clients for DynamoDB, S3 and
 * Secrets Manager behind {@link reactor.core.publisher.Mono}-returning operations that retry
 * transient failures, merge paged results and report failures through a single exception type.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.awstools.core.AwsToolsException} – failure carrying an {@link
 *       com.example.awstools.core.ErrorCode} and an {@link com.example.awstools.core.ErrorContext}.
 *   <li>{@link com.example.awstools.core.retry.Retry} – exponential backoff gated by a {@link
 *       com.example.awstools.core.retry.RetryClassifier}.
 *   <li>{@link com.example.awstools.core.paging.PageAccumulator} – follows cursors and merges pages
 *       up to an optional ceiling.
 *   <li>{@link com.example.awstools.core.dynamo.DynamoTools} – DynamoDB item, query, batch and
 *       transaction operations, with fallback from a caching proxy to direct DynamoDB.
 *   <li>{@link com.example.awstools.core.s3.S3Tools} – object reads in several shapes, writes and
 *       key listing.
 *   <li>{@link com.example.awstools.core.secrets.SecretTools} – secret value, string and JSON
 *       retrieval.
 * </ul>
 */
package com.example.awstools.core;
