/*
 * どこで: Matching ドメインモデル
 * 何を: 1 ユーザー分の offer / need スキル集合を表現する
 * なぜ: 相補判定 (offer ∩ need) を集合演算として扱うため
 */
package com.skillswap.matching.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "コンストラクタで不変コピーを取るため")
public record UserSkills(Set<String> offers, Set<String> needs) {

  public UserSkills {
    offers = Set.copyOf(offers);
    needs = Set.copyOf(needs);
  }

  public static UserSkills empty() {
    return new UserSkills(Set.of(), Set.of());
  }

  public boolean hasOffersAndNeeds() {
    return !offers.isEmpty() && !needs.isEmpty();
  }

  /** このユーザーが offer するスキルのうち、相手が need するもの (カタログ順)。 */
  public List<String> offersNeededBy(UserSkills other, List<String> order) {
    return order.stream().filter(offers::contains).filter(other.needs()::contains).toList();
  }

  /** 双方向に少なくとも 1 つずつスキルが噛み合うか。 */
  public boolean complements(UserSkills other) {
    return intersects(offers, other.needs()) && intersects(needs, other.offers());
  }

  public static Set<String> intersection(Set<String> left, Set<String> right) {
    final Set<String> result = new LinkedHashSet<>(left);
    result.retainAll(right);
    return result;
  }

  private static boolean intersects(Set<String> left, Set<String> right) {
    for (String value : left) {
      if (right.contains(value)) {
        return true;
      }
    }
    return false;
  }
}
