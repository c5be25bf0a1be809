package com.example.connectivityprobe.core.jdbc;

import java.util.Objects;

/**
 * Outcome of one {@link ConnectivityProbe#run} call.
 *
 * <p>Fields that do not apply to the outcome are {@code null}: a failed result only carries
 * {@code error}; a heartbeat result carries {@code version} and {@code databaseTime}.
 *
 * @param status overall outcome
 * @param version server version string
 * @param testRecord the inserted row
 * @param deletedRecordId id of the row deleted during cleanup
 * @param error description of the failure
 * @param databaseTime server time reported by a heartbeat run
 */
public record ProbeResult(
    Status status,
    String version,
    TestRecord testRecord,
    Long deletedRecordId,
    String error,
    String databaseTime) {

  public enum Status {
    SUCCESS,
    FAILED
  }

  public ProbeResult {
    Objects.requireNonNull(status, "status");
    if (status == Status.FAILED && error == null)
      throw new IllegalArgumentException("failed result requires an error");
  }

  public static ProbeResult success(
      final String version, final TestRecord testRecord, final long deletedRecordId) {
    return new ProbeResult(Status.SUCCESS, version, testRecord, deletedRecordId, null, null);
  }

  public static ProbeResult heartbeat(final String version, final String databaseTime) {
    return new ProbeResult(Status.SUCCESS, version, null, null, null, databaseTime);
  }

  public static ProbeResult failed(final String error) {
    return new ProbeResult(Status.FAILED, null, null, null, error, null);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
