/*
 * どこで: Matching データアクセス
 * 何を: PostgreSQL のトランザクションスコープ advisory lock を取得する
 * なぜ: ペア単位/オーナー単位の read-check-write を同時実行から直列化するため
 */
package com.skillswap.matching.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AdvisoryLockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // トランザクション終了時に自動で解放されるため、呼び出し側は @Transactional 内で使うこと
  public void lockByKey(long lockKey) {
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }
}
