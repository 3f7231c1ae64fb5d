/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant / LocalDate / LocalTime を SQL 型へ明示変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず、常に明示型でバインドするため
 */
package com.skillswap.common;

import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp へ渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static Time toSqlTime(LocalTime time) {
    return time == null ? null : Time.valueOf(time);
  }
}
