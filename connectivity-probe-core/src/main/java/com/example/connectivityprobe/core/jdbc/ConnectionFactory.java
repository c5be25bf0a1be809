package com.example.connectivityprobe.core.jdbc;

import com.example.connectivityprobe.core.secrets.CredentialRecord;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

/**
 * Opens one unpooled JDBC connection for a probe invocation. The caller owns and closes the
 * returned connection.
 */
@FunctionalInterface
public interface ConnectionFactory {

  /**
   * Opens a connection using the given credentials.
   *
   * @param credential connection parameters
   * @param timeout upper bound for establishing the connection
   * @return an open connection
   * @throws SQLException on timeout, authentication or network failure
   */
  Connection open(final CredentialRecord credential, final Duration timeout) throws SQLException;

  /**
   * Factory backed by {@link DriverManager} and the PostgreSQL driver. The timeout is passed as
   * both {@code connectTimeout} (socket connect) and {@code loginTimeout} (whole handshake).
   *
   * @return PostgreSQL connection factory
   */
  static ConnectionFactory postgres() {
    return (credential, timeout) -> {
      final var seconds = Long.toString(Math.max(1L, timeout.toSeconds()));
      final var props = new Properties();
      props.setProperty("user", credential.user());
      props.setProperty("password", credential.password());
      props.setProperty("connectTimeout", seconds);
      props.setProperty("loginTimeout", seconds);
      props.setProperty("ApplicationName", "connectivity-probe");
      return DriverManager.getConnection(credential.jdbcUrl(), props);
    };
  }
}
