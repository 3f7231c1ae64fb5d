/*
 * どこで: Matching ドメインモデル
 * 何を: 生成予定の合成ユーザー 1 人分 (名前/offer/need) を表現する
 * なぜ: スキル割り当ての計算と DB 書き込みを分離するため
 */
package com.skillswap.matching.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Set;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "コンストラクタで不変コピーを取るため")
public record CohortMemberPlan(Set<String> offers, Set<String> needs) {

  public CohortMemberPlan {
    offers = Set.copyOf(offers);
    needs = Set.copyOf(needs);
    if (offers.isEmpty() || needs.isEmpty()) {
      throw new IllegalArgumentException("cohort member must offer and need at least one skill");
    }
    for (String offer : offers) {
      if (needs.contains(offer)) {
        throw new IllegalArgumentException("offer and need skills must be disjoint: " + offer);
      }
    }
  }
}
