package com.example.connectivityprobe.core.jdbc;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.connectivityprobe.core.ConnectionException;
import com.example.connectivityprobe.core.ProbeException;
import com.example.connectivityprobe.core.UnexpectedProbeException;
import com.example.connectivityprobe.core.logs.LogStreamHandle;
import com.example.connectivityprobe.core.logs.LogStreamManager;
import com.example.connectivityprobe.core.secrets.CredentialRecord;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies read/write connectivity with a short, self-cleaning transaction.
 *
 * <p>In {@link ProbeMode#TRANSACTION} mode a run connects, reads the server version, inserts one
 * row into a session-scoped temporary table, reads it back, deletes it, checks it is gone and
 * commits. {@link ProbeMode#HEARTBEAT} mode stops after the version and current-time queries.
 *
 * <p>The connection is closed exactly once on every exit path. {@link #run} never throws: a
 * failure to connect and any later fault both produce a {@link ProbeResult.Status#FAILED} result.
 * Every outcome is written to the local log and mirrored to the invocation's log stream.
 */
public final class ConnectivityProbe {

  private static final Logger logger = System.getLogger(ConnectivityProbe.class.getName());

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  static final String MARKER = "Lambda connectivity test";

  static final String VERSION_SQL = "SELECT version()";
  static final String CURRENT_TIME_SQL = "SELECT current_timestamp";
  static final String CREATE_TABLE_SQL =
      """
      CREATE TEMP TABLE IF NOT EXISTS connectivity_probe (
          id serial PRIMARY KEY,
          created_at timestamp,
          test_value text
      )""";
  static final String INSERT_SQL =
      """
      INSERT INTO connectivity_probe (created_at, test_value)
      VALUES (current_timestamp, ?)
      RETURNING id, created_at, test_value""";
  static final String SELECT_BY_ID_SQL =
      "SELECT id, created_at, test_value FROM connectivity_probe WHERE id = ?";
  static final String DELETE_BY_ID_SQL = "DELETE FROM connectivity_probe WHERE id = ?";

  private final ConnectionFactory connectionFactory;
  private final LogStreamManager logStreams;
  private final Duration connectTimeout;
  private final ProbeMode mode;

  /**
   * @param connectionFactory opens the per-invocation connection
   * @param logStreams remote sink for probe events
   * @param connectTimeout connection acquisition bound
   * @param mode what to exercise once connected
   */
  public ConnectivityProbe(
      final ConnectionFactory connectionFactory,
      final LogStreamManager logStreams,
      final Duration connectTimeout,
      final ProbeMode mode) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.logStreams = Objects.requireNonNull(logStreams, "logStreams");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.mode = Objects.requireNonNull(mode, "mode");
    if (connectTimeout.isNegative() || connectTimeout.isZero())
      throw new IllegalArgumentException("connectTimeout must be positive");
  }

  /**
   * Runs the probe.
   *
   * @param credential connection parameters
   * @param handle the invocation's log stream, possibly absent
   * @return the outcome, never {@code null}
   */
  public ProbeResult run(final CredentialRecord credential, final Optional<LogStreamHandle> handle) {
    report(handle, INFO, "Attempting to connect to database at " + credential.host());
    try {
      final var result = connectAndTest(credential, handle);
      report(handle, INFO, "Connectivity test completed against " + credential.host());
      return result;
    } catch (final ConnectionException e) {
      return failed(handle, "Database connection failed: " + e.getMessage(), e);
    } catch (final RuntimeException e) {
      return failed(handle, "Database operation failed: " + describe(e), e);
    }
  }

  private ProbeResult connectAndTest(
      final CredentialRecord credential, final Optional<LogStreamHandle> handle) {
    final var connection = open(credential);
    try (connection) {
      return mode == ProbeMode.HEARTBEAT
          ? heartbeat(connection, handle)
          : transaction(connection, handle);
    } catch (final SQLException e) {
      throw new UnexpectedProbeException(e.getMessage(), e);
    } finally {
      logger.log(INFO, "Database connection closed");
    }
  }

  private Connection open(final CredentialRecord credential) {
    try {
      return connectionFactory.open(credential, connectTimeout);
    } catch (final SQLException e) {
      throw new ConnectionException(e.getMessage(), e);
    }
  }

  private ProbeResult transaction(final Connection conn, final Optional<LogStreamHandle> handle)
      throws SQLException {
    conn.setAutoCommit(false);
    try {
      final var version = queryVersion(conn, handle);
      createTable(conn);

      final var inserted = insert(conn);
      report(handle, INFO, "Test record inserted: " + inserted);

      final var visible =
          findById(conn, inserted.id())
              .orElseThrow(
                  () ->
                      new UnexpectedProbeException(
                          "Test record %d not visible after insert".formatted(inserted.id()),
                          null));
      report(handle, INFO, "Record verification: " + visible);

      deleteById(conn, inserted.id());
      report(handle, INFO, "Deleted test record with ID: " + inserted.id());

      // leftover rows live in a temp table and vanish with the session
      if (findById(conn, inserted.id()).isPresent())
        report(handle, WARNING, "Record still exists after deletion: " + inserted.id());
      else logger.log(INFO, "Record successfully deleted");

      conn.commit();
      return ProbeResult.success(version, inserted, inserted.id());
    } catch (final SQLException | RuntimeException e) {
      rollback(conn);
      throw e;
    }
  }

  private ProbeResult heartbeat(final Connection conn, final Optional<LogStreamHandle> handle)
      throws SQLException {
    final var version = queryVersion(conn, handle);
    try (final var stmt = conn.prepareStatement(CURRENT_TIME_SQL);
        final var rs = stmt.executeQuery()) {
      if (!rs.next()) throw new UnexpectedProbeException("current_timestamp returned no row", null);
      final var now = rs.getString(1);
      report(handle, INFO, "Database current timestamp: " + now);
      return ProbeResult.heartbeat(version, now);
    }
  }

  private String queryVersion(final Connection conn, final Optional<LogStreamHandle> handle)
      throws SQLException {
    try (final var stmt = conn.prepareStatement(VERSION_SQL);
        final var rs = stmt.executeQuery()) {
      if (!rs.next()) throw new UnexpectedProbeException("version() returned no row", null);
      final var version = rs.getString(1);
      report(handle, INFO, "Database version: " + version);
      return version;
    }
  }

  private void createTable(final Connection conn) throws SQLException {
    try (final var stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
      stmt.execute();
    }
  }

  private TestRecord insert(final Connection conn) throws SQLException {
    try (final var stmt = conn.prepareStatement(INSERT_SQL)) {
      stmt.setString(1, MARKER);
      try (final var rs = stmt.executeQuery()) {
        if (!rs.next()) throw new UnexpectedProbeException("INSERT returned no row", null);
        return new TestRecord(
            rs.getLong(1), rs.getObject(2, LocalDateTime.class), rs.getString(3));
      }
    }
  }

  private Optional<TestRecord> findById(final Connection conn, final long id)
      throws SQLException {
    try (final var stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
      stmt.setLong(1, id);
      try (final var rs = stmt.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        return Optional.of(
            new TestRecord(rs.getLong(1), rs.getObject(2, LocalDateTime.class), rs.getString(3)));
      }
    }
  }

  private void deleteById(final Connection conn, final long id) throws SQLException {
    try (final var stmt = conn.prepareStatement(DELETE_BY_ID_SQL)) {
      stmt.setLong(1, id);
      stmt.executeUpdate();
    }
  }

  private void rollback(final Connection conn) {
    try {
      conn.rollback();
    } catch (final SQLException e) {
      logger.log(WARNING, "Rollback failed", e);
    }
  }

  private ProbeResult failed(
      final Optional<LogStreamHandle> handle, final String error, final Throwable cause) {
    logger.log(ERROR, error, cause);
    logStreams.emit(handle, error, ERROR);
    return ProbeResult.failed(error);
  }

  private void report(final Optional<LogStreamHandle> handle, final Level level, final String msg) {
    logger.log(level, msg);
    logStreams.emit(handle, msg, level);
  }

  private static String describe(final RuntimeException e) {
    if (e instanceof ProbeException) return e.getMessage();
    return Optional.ofNullable(e.getMessage())
        .map(m -> e.getClass().getSimpleName() + ": " + m)
        .orElse(e.getClass().getSimpleName());
  }
}
