/*
 * どこで: Matching データアクセス
 * 何を: users (実ユーザー/合成ユーザー) の登録/更新/参照を行う
 * なぜ: オーナー単位の合成ユーザー分離を SQL 条件で一貫して保証するため
 */
package com.skillswap.matching.repository;

import static com.skillswap.common.JdbcTimestampUtils.toInstant;
import static com.skillswap.common.JdbcTimestampUtils.toTimestamp;

import com.skillswap.matching.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private static final String COLUMNS =
      "id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(long userId) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UserRecord> findByIds(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id IN (:userIds) ORDER BY id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public UserRecord insertRealUser(String displayName, Instant createdAt) {
    final String sql =
        """
        INSERT INTO users (display_name, latitude, longitude, is_synthetic, owner_user_id, created_at)
        VALUES (:displayName, NULL, NULL, FALSE, NULL, :createdAt)
        RETURNING id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("displayName", displayName)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public UserRecord insertSyntheticUser(
      long ownerUserId, String displayName, double latitude, double longitude, Instant createdAt) {
    final String sql =
        """
        INSERT INTO users (display_name, latitude, longitude, is_synthetic, owner_user_id, created_at)
        VALUES (:displayName, :latitude, :longitude, TRUE, :ownerUserId, :createdAt)
        RETURNING id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("displayName", displayName)
            .addValue("latitude", latitude)
            .addValue("longitude", longitude)
            .addValue("ownerUserId", ownerUserId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<UserRecord> updateDisplayName(long userId, String displayName) {
    final String sql =
        """
        UPDATE users
        SET display_name = :displayName
        WHERE id = :userId
        RETURNING id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("displayName", displayName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<UserRecord> updateLocation(long userId, double latitude, double longitude) {
    final String sql =
        """
        UPDATE users
        SET latitude = :latitude,
            longitude = :longitude
        WHERE id = :userId
        RETURNING id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("latitude", latitude)
            .addValue("longitude", longitude);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 探索対象: 実ユーザー全員と、requester が所有する合成ユーザーのみ。位置未登録は除外。 */
  public List<UserRecord> findDiscoverableCandidates(long requesterId) {
    final String sql =
        """
        SELECT id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        FROM users
        WHERE id <> :requesterId
          AND latitude IS NOT NULL
          AND longitude IS NOT NULL
          AND (is_synthetic = FALSE OR owner_user_id = :requesterId)
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requesterId", requesterId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<UserRecord> findSyntheticByOwner(long ownerUserId) {
    final String sql =
        """
        SELECT id, display_name, latitude, longitude, is_synthetic, owner_user_id, created_at
        FROM users
        WHERE is_synthetic = TRUE AND owner_user_id = :ownerUserId
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ownerUserId", ownerUserId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countSyntheticByOwner(long ownerUserId) {
    final String sql =
        "SELECT COUNT(*) FROM users WHERE is_synthetic = TRUE AND owner_user_id = :ownerUserId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ownerUserId", ownerUserId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  // 関連する skills / interests / meetings は FK の ON DELETE CASCADE で消える
  public int deleteSyntheticByOwner(long ownerUserId) {
    final String sql =
        "DELETE FROM users WHERE is_synthetic = TRUE AND owner_user_id = :ownerUserId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ownerUserId", ownerUserId);
    return jdbcTemplate.update(sql, params);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("display_name"),
        rs.getObject("latitude", Double.class),
        rs.getObject("longitude", Double.class),
        rs.getBoolean("is_synthetic"),
        rs.getObject("owner_user_id", Long.class),
        toInstant(rs.getTimestamp("created_at")));
  }
}
