/*
 * どこで: Matching データアクセス
 * 何を: user_skills (offer / need) の置換/参照と、オーナー単位の offer 件数集計を行う
 * なぜ: 相補判定とスキル網羅率の検証を同じテーブル定義の上で行うため
 */
package com.skillswap.matching.repository;

import com.skillswap.matching.model.SkillDirection;
import com.skillswap.matching.model.UserSkills;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SkillAssignmentRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UserSkills findByUserId(long userId) {
    return findByUserIds(List.of(userId)).getOrDefault(userId, UserSkills.empty());
  }

  public Map<Long, UserSkills> findByUserIds(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT user_id, skill_name, direction
        FROM user_skills
        WHERE user_id IN (:userIds)
        ORDER BY user_id, skill_name
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    final Map<Long, Set<String>> offers = new HashMap<>();
    final Map<Long, Set<String>> needs = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          final long userId = rs.getLong("user_id");
          final SkillDirection direction = SkillDirection.valueOf(rs.getString("direction"));
          final Map<Long, Set<String>> target = direction == SkillDirection.OFFER ? offers : needs;
          target
              .computeIfAbsent(userId, ignored -> new LinkedHashSet<>())
              .add(rs.getString("skill_name"));
        });
    final Map<Long, UserSkills> result = new HashMap<>();
    for (Long userId : userIds) {
      result.put(
          userId,
          new UserSkills(
              offers.getOrDefault(userId, Set.of()), needs.getOrDefault(userId, Set.of())));
    }
    return result;
  }

  /** offer / need の両方を丸ごと置き換える。 */
  @Transactional
  public void replaceAll(long userId, Collection<String> offers, Collection<String> needs) {
    jdbcTemplate.update(
        "DELETE FROM user_skills WHERE user_id = :userId",
        new MapSqlParameterSource().addValue("userId", userId));
    insertAll(userId, offers, needs);
  }

  public void insertAll(long userId, Collection<String> offers, Collection<String> needs) {
    final List<SqlParameterSource> batch = new ArrayList<>();
    for (String skill : offers) {
      batch.add(row(userId, skill, SkillDirection.OFFER));
    }
    for (String skill : needs) {
      batch.add(row(userId, skill, SkillDirection.NEED));
    }
    if (batch.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO user_skills (user_id, skill_name, direction)
        VALUES (:userId, :skillName, :direction)
        ON CONFLICT (user_id, skill_name, direction) DO NOTHING
        """;
    jdbcTemplate.batchUpdate(sql, batch.toArray(SqlParameterSource[]::new));
  }

  public void replaceNeeds(long userId, Collection<String> needs) {
    jdbcTemplate.update(
        "DELETE FROM user_skills WHERE user_id = :userId AND direction = 'NEED'",
        new MapSqlParameterSource().addValue("userId", userId));
    insertAll(userId, List.of(), needs);
  }

  /** オーナーの合成ユーザー群で、スキルごとに何人が offer しているか。 */
  public Map<String, Integer> countOffersBySkillForOwner(long ownerUserId) {
    final String sql =
        """
        SELECT us.skill_name, COUNT(*) AS offer_count
        FROM user_skills us
        JOIN users u ON u.id = us.user_id
        WHERE u.is_synthetic = TRUE
          AND u.owner_user_id = :ownerUserId
          AND us.direction = 'OFFER'
        GROUP BY us.skill_name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ownerUserId", ownerUserId);
    final Map<String, Integer> counts = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(rs.getString("skill_name"), rs.getInt("offer_count"));
        });
    return counts;
  }

  private SqlParameterSource row(long userId, String skill, SkillDirection direction) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("skillName", skill)
        .addValue("direction", direction.name());
  }
}
