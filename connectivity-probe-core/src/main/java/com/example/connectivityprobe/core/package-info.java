/**
 * Root package for the connectivity-probe library.
 *
 * <p>This package contains the entry point that runs one database connectivity check per
 * invocation, the response schema returned to the invoker, and the closed set of failure kinds.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.connectivityprobe.core.ProbeOrchestrator} – sequences one invocation and
 *       always produces a {@link com.example.connectivityprobe.core.ResponseEnvelope}.
 *   <li>{@link com.example.connectivityprobe.core.ProbeConfig} – settings read from system
 *       properties and environment variables.
 *   <li>{@link com.example.connectivityprobe.core.AwsClients} – process-scoped Secrets Manager and
 *       CloudWatch Logs clients (supports endpoint/region/credentials overrides).
 *   <li>{@link com.example.connectivityprobe.core.secrets.SecretResolver} – fetches the secret and
 *       validates it into a {@code CredentialRecord}.
 *   <li>{@link com.example.connectivityprobe.core.logs.LogStreamManager} – best-effort
 *       per-invocation CloudWatch Logs stream.
 *   <li>{@link com.example.connectivityprobe.core.jdbc.ConnectivityProbe} – connect, write, read,
 *       delete and commit against a temporary table.
 *   <li>{@link com.example.connectivityprobe.core.ProbeException} – base of {@code
 *       ConnectionException}, {@code SecretAccessException}, {@code SecretFormatException}, {@code
 *       LogServiceException} and {@code UnexpectedProbeException}.
 * </ul>
 */
package com.example.connectivityprobe.core;
