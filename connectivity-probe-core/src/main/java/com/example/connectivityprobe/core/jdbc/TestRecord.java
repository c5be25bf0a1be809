package com.example.connectivityprobe.core.jdbc;

import java.time.LocalDateTime;

/**
 * Row written by the probe into its temporary table.
 *
 * @param id generated primary key
 * @param timestamp database time at insert
 * @param text marker value
 */
public record TestRecord(long id, LocalDateTime timestamp, String text) {}
