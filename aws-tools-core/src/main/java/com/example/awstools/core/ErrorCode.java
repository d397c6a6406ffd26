package com.example.awstools.core;

/** Stable, machine-checkable failure codes carried by {@link AwsToolsException}. */
public enum ErrorCode {
  /** Arguments were missing or malformed; raised before any backend call. */
  BAD_PARAM,
  /** The requested blob or secret value does not exist. */
  NOT_FOUND,
  /** The backend failed permanently, or transiently until the retry budget ran out. */
  BACKEND_FAILURE,
  /** Both the caching-proxy client and the direct fallback client failed. */
  FALLBACK_EXHAUSTED,
  /** A payload could not be decompressed or parsed. */
  DECODE_FAILURE
}
