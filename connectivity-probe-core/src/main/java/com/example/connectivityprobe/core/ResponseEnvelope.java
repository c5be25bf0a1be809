package com.example.connectivityprobe.core;

import com.example.connectivityprobe.core.jdbc.ProbeResult;
import com.example.connectivityprobe.core.jdbc.TestRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;

/**
 * Response returned to the invoker of a probe.
 *
 * @param statusCode {@value #OK} when the probe passed, {@value #ERROR} otherwise
 * @param body response details
 */
public record ResponseEnvelope(int statusCode, Body body) {

  public static final int OK = 200;
  public static final int ERROR = 500;

  private static final ObjectMapper MAPPER = objectMapper();

  public ResponseEnvelope {
    if (statusCode != OK && statusCode != ERROR)
      throw new IllegalArgumentException("statusCode must be 200 or 500: " + statusCode);
    Objects.requireNonNull(body, "body");
    if (statusCode == ERROR && body.error() == null)
      throw new IllegalArgumentException("error responses must carry an error");
  }

  /**
   * Response payload. Absent values are omitted from the JSON form.
   *
   * @param message summary of the outcome
   * @param version server version
   * @param testRecord row inserted by the probe
   * @param deletedRecordId id of the row deleted during cleanup
   * @param error failure description
   * @param logStream CloudWatch stream holding this invocation's events
   * @param databaseTime server time reported by a heartbeat
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Body(
      String message,
      String version,
      TestRecord testRecord,
      Long deletedRecordId,
      String error,
      String logStream,
      String databaseTime) {

    public Body {
      if (message == null || message.isBlank())
        throw new IllegalArgumentException("message is required");
    }
  }

  /** Builds the 200 response for a successful probe result. */
  public static ResponseEnvelope success(
      final String message, final ProbeResult result, final String logStream) {
    if (!result.isSuccess()) throw new IllegalArgumentException("result is not a success");
    return new ResponseEnvelope(
        OK,
        new Body(
            message,
            result.version(),
            result.testRecord(),
            result.deletedRecordId(),
            null,
            logStream,
            result.databaseTime()));
  }

  /** Builds a 500 response. */
  public static ResponseEnvelope failure(
      final String message, final String error, final String logStream) {
    return new ResponseEnvelope(
        ERROR, new Body(message, null, null, null, error, logStream, null));
  }

  /**
   * Serializes this envelope.
   *
   * @return JSON form of the envelope
   */
  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize response", e);
    }
  }

  /** Mapper used for envelopes: ISO-8601 timestamps, nulls omitted. */
  public static ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }
}
