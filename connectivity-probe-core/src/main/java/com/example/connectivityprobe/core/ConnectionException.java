package com.example.connectivityprobe.core;

/** Opening the database connection failed (timeout, authentication, network). */
public class ConnectionException extends ProbeException {

  public ConnectionException(final String message, final Throwable cause) {
    super(Kind.CONNECTION, message, cause);
  }
}
