package com.example.connectivityprobe.core;

/** A CloudWatch Logs operation failed. */
public class LogServiceException extends ProbeException {

  public LogServiceException(final String message, final Throwable cause) {
    super(Kind.LOG_SERVICE, message, cause);
  }
}
