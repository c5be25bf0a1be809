package com.example.connectivityprobe.core.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire shape of the database secret as stored in AWS Secrets Manager.
 *
 * <p>Matches the RDS-managed secret layout. {@code engine} is accepted and ignored; any other
 * field is rejected by the resolver's mapper.
 */
record SecretPayload(
    @JsonProperty("host") String host,
    @JsonProperty("port") String port,
    @JsonProperty("dbname") String dbname,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("engine") String engine) {}
