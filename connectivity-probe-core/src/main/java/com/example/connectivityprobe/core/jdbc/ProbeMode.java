package com.example.connectivityprobe.core.jdbc;

/** What a probe run exercises once connected. */
public enum ProbeMode {
  /** Version query plus an insert/read/delete round trip on a temporary table. */
  TRANSACTION,
  /** Version and current-time queries only. */
  HEARTBEAT
}
