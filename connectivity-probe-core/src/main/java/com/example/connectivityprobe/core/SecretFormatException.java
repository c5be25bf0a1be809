package com.example.connectivityprobe.core;

/** The secret exists but its payload is binary or is not a valid credential document. */
public class SecretFormatException extends ProbeException {

  public SecretFormatException(final String message) {
    this(message, null);
  }

  public SecretFormatException(final String message, final Throwable cause) {
    super(Kind.SECRET_FORMAT, message, cause);
  }
}
