package com.relgraph.db.util;

import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for database operations. */
public final class DbUtil {

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Gets an Instant from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Gets an optional Instant, returning Optional.empty() if the column is null. */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Binds an Instant, or SQL NULL when absent. */
  public static void setOptionalTimestamp(
      PreparedStatement stmt, int index, @Nullable Instant value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    } else {
      stmt.setTimestamp(index, toSqlTimestamp(value));
    }
  }

  /** Subject relations are stored as '' rather than NULL so the unique key covers them. */
  @Nonnull
  public static String emptyIfNull(@Nullable String value) {
    return value == null ? "" : value;
  }
}
