package com.example.awstools.core.dynamo;

/**
 * What the primary DynamoDB client talks to, declared when the tools are built.
 *
 * <p>Only {@link #CACHE_PROXY} clients get a direct-DynamoDB fallback once their retries are
 * exhausted.
 */
public enum ClientKind {
  /** The client talks to DynamoDB itself. */
  DIRECT,
  /** The client talks to a caching front-end such as DAX. */
  CACHE_PROXY
}
