package com.example.connectivityprobe.core;

/** Secrets Manager refused or failed the {@code GetSecretValue} call. */
public class SecretAccessException extends ProbeException {

  private final String errorCode;

  /**
   * @param errorCode AWS error code reported by Secrets Manager, e.g. {@code
   *     ResourceNotFoundException}
   * @param message human readable description
   * @param cause the SDK exception
   */
  public SecretAccessException(
      final String errorCode, final String message, final Throwable cause) {
    super(Kind.SECRET_ACCESS, message, cause);
    this.errorCode = errorCode;
  }

  public String errorCode() {
    return errorCode;
  }
}
