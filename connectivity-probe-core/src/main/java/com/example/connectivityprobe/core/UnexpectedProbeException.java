package com.example.connectivityprobe.core;

/** Runtime fault raised by a probe step after the connection was established. */
public class UnexpectedProbeException extends ProbeException {

  public UnexpectedProbeException(final String message, final Throwable cause) {
    super(Kind.UNEXPECTED, message, cause);
  }
}
