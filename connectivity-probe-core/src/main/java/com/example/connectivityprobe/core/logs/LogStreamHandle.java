package com.example.connectivityprobe.core.logs;

/**
 * Identifies the CloudWatch Logs stream created for one invocation.
 *
 * @param logGroupName the log group holding the stream
 * @param streamName the per-invocation stream name
 */
public record LogStreamHandle(String logGroupName, String streamName) {}
