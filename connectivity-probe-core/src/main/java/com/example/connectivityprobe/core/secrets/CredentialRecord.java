package com.example.connectivityprobe.core.secrets;

import java.util.Objects;

/**
 * Validated connection parameters for one probe invocation.
 *
 * @param host database host name or address
 * @param port database port, {@value #DEFAULT_PORT} when the secret omits it
 * @param database database name
 * @param user database user
 * @param password database password, never printed by {@link #toString()}
 */
public record CredentialRecord(
    String host, String port, String database, String user, String password) {

  public static final String DEFAULT_PORT = "5432";

  public CredentialRecord {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(password, "password");
    if (port == null || port.isBlank()) port = DEFAULT_PORT;
  }

  /** PostgreSQL JDBC URL for this record. */
  public String jdbcUrl() {
    return "jdbc:postgresql://%s:%s/%s".formatted(host, port, database);
  }

  @Override
  public String toString() {
    return "CredentialRecord[host=%s, port=%s, database=%s, user=%s, password=****]"
        .formatted(host, port, database, user);
  }
}
