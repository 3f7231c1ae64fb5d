/*
 * どこで: Matching データアクセス
 * 何を: meetings の作成/状態更新/確認フラグ更新/参照を行う
 * なぜ: ペアごとに 1 件のミーティングという制約を DB の一意制約と合わせて扱うため
 */
package com.skillswap.matching.repository;

import static com.skillswap.common.JdbcTimestampUtils.toInstant;
import static com.skillswap.common.JdbcTimestampUtils.toSqlDate;
import static com.skillswap.common.JdbcTimestampUtils.toSqlTime;
import static com.skillswap.common.JdbcTimestampUtils.toTimestamp;

import com.skillswap.matching.model.MeetingRecord;
import com.skillswap.matching.model.MeetingStatus;
import com.skillswap.matching.model.PairId;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MeetingRepository {

  private static final String RETURNING =
      """
      RETURNING id, user_low_id, user_high_id, proposer_id, location, proposed_date, proposed_time,
                status, confirmed_by_low, confirmed_by_high, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MeetingRecord insert(
      PairId pairId,
      long proposerId,
      String location,
      LocalDate proposedDate,
      LocalTime proposedTime,
      Instant now) {
    final String sql =
        """
        INSERT INTO meetings (
          user_low_id,
          user_high_id,
          proposer_id,
          location,
          proposed_date,
          proposed_time,
          status,
          confirmed_by_low,
          confirmed_by_high,
          created_at,
          updated_at
        ) VALUES (
          :userLowId,
          :userHighId,
          :proposerId,
          :location,
          :proposedDate,
          :proposedTime,
          :status,
          FALSE,
          FALSE,
          :now,
          :now
        )
        """
            + RETURNING;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userLowId", pairId.lowUserId())
            .addValue("userHighId", pairId.highUserId())
            .addValue("proposerId", proposerId)
            .addValue("location", location)
            .addValue("proposedDate", toSqlDate(proposedDate))
            .addValue("proposedTime", toSqlTime(proposedTime))
            .addValue("status", MeetingStatus.PROPOSED.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<MeetingRecord> findById(long meetingId) {
    final String sql = selectColumns() + " WHERE id = :meetingId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("meetingId", meetingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MeetingRecord> findByPair(PairId pairId) {
    final String sql =
        selectColumns() + " WHERE user_low_id = :userLowId AND user_high_id = :userHighId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userLowId", pairId.lowUserId())
            .addValue("userHighId", pairId.highUserId());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<MeetingRecord> findByParticipant(long userId) {
    final String sql =
        selectColumns() + " WHERE user_low_id = :userId OR user_high_id = :userId ORDER BY id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public MeetingRecord updateStatus(long meetingId, MeetingStatus status, Instant updatedAt) {
    final String sql =
        """
        UPDATE meetings
        SET status = :status,
            updated_at = :updatedAt
        WHERE id = :meetingId
        """
            + RETURNING;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("meetingId", meetingId)
            .addValue("status", status.name())
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /**
   * 指定した参加者の確認フラグを立てる。両者の確認が揃った場合はこの UPDATE の中で COMPLETED に進める。
   * CHECK 制約 (COMPLETED ⇒ 両フラグ true) と同じ条件を CASE 式で評価する。
   */
  public MeetingRecord markConfirmed(long meetingId, boolean lowSide, Instant updatedAt) {
    final String sql =
        """
        UPDATE meetings
        SET confirmed_by_low = confirmed_by_low OR :confirmLow,
            confirmed_by_high = confirmed_by_high OR :confirmHigh,
            status = CASE
              WHEN (confirmed_by_low OR :confirmLow) AND (confirmed_by_high OR :confirmHigh)
                THEN 'COMPLETED'
              ELSE status
            END,
            updated_at = :updatedAt
        WHERE id = :meetingId
        """
            + RETURNING;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("meetingId", meetingId)
            .addValue("confirmLow", lowSide)
            .addValue("confirmHigh", !lowSide)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private String selectColumns() {
    return """
        SELECT id, user_low_id, user_high_id, proposer_id, location, proposed_date, proposed_time,
               status, confirmed_by_low, confirmed_by_high, created_at, updated_at
        FROM meetings
        """;
  }

  private MeetingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MeetingRecord(
        rs.getLong("id"),
        rs.getLong("user_low_id"),
        rs.getLong("user_high_id"),
        rs.getLong("proposer_id"),
        rs.getString("location"),
        rs.getDate("proposed_date").toLocalDate(),
        rs.getTime("proposed_time").toLocalTime(),
        MeetingStatus.valueOf(rs.getString("status")),
        rs.getBoolean("confirmed_by_low"),
        rs.getBoolean("confirmed_by_high"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
