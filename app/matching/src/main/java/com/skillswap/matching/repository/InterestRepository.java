/*
 * どこで: Matching データアクセス
 * 何を: match_interests (有向の興味エッジ) の登録/削除/参照を行う
 * なぜ: 相互成立を「2 本の有向エッジの積」として読み出し時に計算するため
 */
package com.skillswap.matching.repository;

import static com.skillswap.common.JdbcTimestampUtils.toInstant;
import static com.skillswap.common.JdbcTimestampUtils.toTimestamp;

import com.skillswap.matching.model.MutualInterestRecord;
import com.skillswap.matching.model.UserRecord;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class InterestRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 既に同じ向きのエッジがあれば何もしない。挿入した行数 (0 or 1) を返す。 */
  public int insertIfAbsent(long fromUserId, long toUserId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO match_interests (from_user_id, to_user_id, created_at)
        VALUES (:fromUserId, :toUserId, :createdAt)
        ON CONFLICT (from_user_id, to_user_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        edge(fromUserId, toUserId).addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public boolean exists(long fromUserId, long toUserId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM match_interests
          WHERE from_user_id = :fromUserId AND to_user_id = :toUserId
        )
        """;
    final Boolean exists =
        jdbcTemplate.queryForObject(sql, edge(fromUserId, toUserId), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public int delete(long fromUserId, long toUserId) {
    final String sql =
        "DELETE FROM match_interests WHERE from_user_id = :fromUserId AND to_user_id = :toUserId";
    return jdbcTemplate.update(sql, edge(fromUserId, toUserId));
  }

  public Set<Long> findTargetsOf(long fromUserId) {
    final String sql = "SELECT to_user_id FROM match_interests WHERE from_user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", fromUserId);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, Long.class));
  }

  public Set<Long> findSourcesOf(long toUserId) {
    final String sql = "SELECT from_user_id FROM match_interests WHERE to_user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", toUserId);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, Long.class));
  }

  /** userId から出たエッジのうち、逆向きのエッジも存在する相手 (= 相互成立) を返す。 */
  public List<MutualInterestRecord> findMutual(long userId) {
    final String sql =
        """
        SELECT u.id, u.display_name, u.latitude, u.longitude, u.is_synthetic, u.owner_user_id,
               u.created_at, mine.created_at AS matched_at
        FROM match_interests mine
        JOIN match_interests theirs
          ON theirs.from_user_id = mine.to_user_id
         AND theirs.to_user_id = mine.from_user_id
        JOIN users u ON u.id = mine.to_user_id
        WHERE mine.from_user_id = :userId
        ORDER BY mine.created_at DESC, u.id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new MutualInterestRecord(
                new UserRecord(
                    rs.getLong("id"),
                    rs.getString("display_name"),
                    rs.getObject("latitude", Double.class),
                    rs.getObject("longitude", Double.class),
                    rs.getBoolean("is_synthetic"),
                    rs.getObject("owner_user_id", Long.class),
                    toInstant(rs.getTimestamp("created_at"))),
                toInstant(rs.getTimestamp("matched_at"))));
  }

  private MapSqlParameterSource edge(long fromUserId, long toUserId) {
    return new MapSqlParameterSource()
        .addValue("fromUserId", fromUserId)
        .addValue("toUserId", toUserId);
  }
}
