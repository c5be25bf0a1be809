package com.example.connectivityprobe.core;

/**
 * Base type for the failures raised while probing the database.
 *
 * <p>Every failure belongs to exactly one {@link Kind}. The kind only drives diagnostics; callers
 * decide control flow by the layer that caught the exception, not by the kind.
 */
public abstract class ProbeException extends RuntimeException {

  /** Closed set of failure kinds. */
  public enum Kind {
    /** Timeout, authentication or network failure while opening the connection. */
    CONNECTION,
    /** Secrets Manager rejected the request (not found, access denied, throttled...). */
    SECRET_ACCESS,
    /** The secret payload is binary or does not match the credential schema. */
    SECRET_FORMAT,
    /** CloudWatch Logs call failed. Never escapes the log stream layer. */
    LOG_SERVICE,
    /** Any other runtime fault after the connection was opened. */
    UNEXPECTED
  }

  private final Kind kind;

  protected ProbeException(final Kind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
