/*
 * Where: Shared JDBC utilities
 * What: Converts between Instant and java.sql.Timestamp for named-parameter binding
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant
 */
package com.raidledger.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are always UTC; timestamptz columns keep them UTC regardless of session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
